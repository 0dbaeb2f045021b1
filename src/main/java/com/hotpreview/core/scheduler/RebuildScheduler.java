package com.hotpreview.core.scheduler;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.logging.MdcContext;
import com.hotpreview.core.metrics.PreviewMetrics;
import com.hotpreview.core.model.ChangeEvent;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.model.RebuildJob;
import com.hotpreview.core.model.RebuildOutcome;
import com.hotpreview.core.model.RebuildStatus;
import com.hotpreview.core.model.RebuildTrigger;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Serializes rebuilds per project: Idle, Queued, Running, then back to Idle.
 * <p>
 * Each project has a lane holding at most one running job and at most one queued job.
 * Triggers that arrive while a job is queued or running fold into the queued job. A lane
 * drains on one worker at a time, so completions for a project are reported in the order
 * the jobs finished, and the outcome of a job is reported before its successor starts.
 * Every lane owns its worker thread, so a long compile in one project never delays another.
 */
@Service
public class RebuildScheduler {

    private static final Logger log = LoggerFactory.getLogger(RebuildScheduler.class);

    private final ConcurrentHashMap<String, Lane> lanes = new ConcurrentHashMap<>();
    private final Function<Project, RebuildStep> stepFactory;
    private final PreviewMetrics metrics;
    private final AtomicInteger laneCounter = new AtomicInteger();

    @Autowired
    public RebuildScheduler(PreviewProperties properties, @Autowired(required = false) PreviewMetrics metrics) {
        this(compileStepFactory(properties.getRebuild()), metrics);
    }

    public RebuildScheduler(Function<Project, RebuildStep> stepFactory, PreviewMetrics metrics) {
        this.stepFactory = stepFactory;
        this.metrics = metrics;
    }

    /**
     * Builds compile-step runners from a project's descriptor; projects without one get {@link RebuildStep#NOOP}.
     */
    public static Function<Project, RebuildStep> compileStepFactory(PreviewProperties.Rebuild config) {
        return project -> project.compileStepOpt()
                .<RebuildStep>map(step -> new CompileStepRunner(step, project.rootPath(),
                        config.getCompileTimeoutSeconds(), config.getMaxErrorOutputBytes()))
                .orElse(RebuildStep.NOOP);
    }

    public void register(Project project, RebuildListener listener) {
        Lane previous = lanes.put(project.id(), new Lane(project, stepFactory.apply(project), listener));
        if (previous != null) {
            previous.cancel();
        }
    }

    /**
     * Swaps in new proxy/compile settings. A job already running keeps the step it started with.
     */
    public void updateProject(Project project) {
        Lane lane = lanes.get(project.id());
        if (lane != null) {
            lane.update(project, stepFactory.apply(project));
        }
    }

    /**
     * Requests a rebuild.
     *
     * @param batch change events behind a file-change trigger; may be empty for a manual trigger
     * @return {@code false} if the project has no lane or the trigger carried nothing to build
     */
    public boolean trigger(String projectId, List<ChangeEvent> batch, RebuildTrigger cause) {
        Lane lane = lanes.get(projectId);
        if (lane == null) {
            log.debug("Ignoring {} trigger for unknown project {}", cause.wireName(), projectId);
            return false;
        }
        List<ChangeEvent> events = batch == null ? List.of() : batch;
        if (cause == RebuildTrigger.FILE_CHANGE && events.isEmpty()) {
            log.debug("Ignoring empty file-change trigger for project {}", projectId);
            return false;
        }
        return lane.enqueue(events, cause);
    }

    /**
     * Drops the queued job and cancels the running one. Cancellation is not reported as a failure.
     */
    public void cancel(String projectId) {
        Lane lane = lanes.remove(projectId);
        if (lane != null) {
            lane.cancel();
        }
    }

    public Optional<RebuildJob> runningJob(String projectId) {
        Lane lane = lanes.get(projectId);
        return lane == null ? Optional.empty() : Optional.ofNullable(lane.runningJob());
    }

    public Optional<RebuildJob> queuedJob(String projectId) {
        Lane lane = lanes.get(projectId);
        return lane == null ? Optional.empty() : Optional.ofNullable(lane.queuedJob());
    }

    @PreDestroy
    public void shutdown() {
        for (String projectId : new ArrayList<>(lanes.keySet())) {
            cancel(projectId);
        }
    }

    private void recordOutcome(RebuildStatus status, Duration duration) {
        if (metrics != null) {
            metrics.recordRebuild(status.name().toLowerCase(Locale.ROOT), duration);
        }
    }

    private final class Lane {
        private final String projectId;
        private final RebuildListener listener;
        private final ExecutorService worker;
        private RebuildStep step;
        private RebuildJob queued;
        private RebuildJob running;
        private Cancellation runningCancellation;
        private boolean draining;
        private boolean cancelled;

        Lane(Project project, RebuildStep step, RebuildListener listener) {
            this.projectId = project.id();
            this.step = step;
            this.listener = listener;
            String threadName = "rebuild-" + projectId + "-" + laneCounter.incrementAndGet();
            this.worker = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                return t;
            });
        }

        synchronized void update(Project project, RebuildStep newStep) {
            this.step = newStep;
            log.debug("Rebuild settings updated for project {}", project.id());
        }

        synchronized RebuildJob runningJob() {
            return running;
        }

        synchronized RebuildJob queuedJob() {
            return queued;
        }

        synchronized boolean enqueue(List<ChangeEvent> events, RebuildTrigger cause) {
            if (cancelled) {
                return false;
            }
            if (queued == null) {
                queued = RebuildJob.queued(projectId, cause, events);
                log.debug("Queued rebuild {} for project {} ({} event(s))", queued.id(), projectId, events.size());
            } else {
                queued = queued.mergedWith(events, cause);
                log.debug("Merged {} event(s) into queued rebuild {}", events.size(), queued.id());
            }
            if (!draining) {
                draining = true;
                try {
                    worker.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    draining = false;
                    queued = null;
                    log.warn("Rebuild for project {} rejected, scheduler is shutting down", projectId);
                    return false;
                }
            }
            return true;
        }

        synchronized void cancel() {
            cancelled = true;
            if (queued != null) {
                log.debug("Dropping queued rebuild {} for project {}", queued.id(), projectId);
                queued = null;
            }
            if (runningCancellation != null) {
                log.info("Cancelling running rebuild {} for project {}", running.id(), projectId);
                runningCancellation.cancel();
            }
            // the running drain sees the flag and exits; the thread ends with it
            worker.shutdown();
        }

        private void drain() {
            while (true) {
                RebuildJob job;
                RebuildStep currentStep;
                Cancellation cancellation;
                synchronized (this) {
                    if (cancelled || queued == null) {
                        draining = false;
                        return;
                    }
                    job = queued.running();
                    queued = null;
                    running = job;
                    currentStep = step;
                    cancellation = new Cancellation();
                    runningCancellation = cancellation;
                }
                RebuildOutcome outcome = run(job, currentStep, cancellation);
                synchronized (this) {
                    running = null;
                    runningCancellation = null;
                }
                if (outcome != null) {
                    report(outcome);
                }
            }
        }

        private RebuildOutcome run(RebuildJob job, RebuildStep currentStep, Cancellation cancellation) {
            MdcContext.setJob(projectId, job.id());
            Instant started = Instant.now();
            try {
                log.info("Rebuild {} started ({}, {} file(s))", job.id(), job.trigger().wireName(),
                        job.affectedPaths().size());
                notifyStarted(job);

                RebuildJob finished;
                try {
                    currentStep.execute(job, cancellation);
                    finished = job.succeeded();
                } catch (BuildException e) {
                    finished = job.failed(e.getMessage(), e.isTimedOut());
                } catch (RuntimeException e) {
                    log.error("Rebuild {} failed unexpectedly", job.id(), e);
                    finished = job.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false);
                }
                Duration duration = Duration.between(started, Instant.now());

                if (cancellation.isCancelled()) {
                    recordOutcome(RebuildStatus.CANCELLED, duration);
                    log.info("Rebuild {} cancelled after {}ms", job.id(), duration.toMillis());
                    return null;
                }
                recordOutcome(finished.status(), duration);
                if (finished.status() == RebuildStatus.FAILED) {
                    log.warn("Rebuild {} failed after {}ms{}", job.id(), duration.toMillis(),
                            finished.timedOut() ? " (timed out)" : "");
                } else {
                    log.info("Rebuild {} succeeded in {}ms", job.id(), duration.toMillis());
                }
                return new RebuildOutcome(projectId, finished, duration);
            } finally {
                MdcContext.clear();
            }
        }

        private void notifyStarted(RebuildJob job) {
            try {
                listener.onStarted(job);
            } catch (RuntimeException e) {
                log.warn("Rebuild listener failed on start of {}: {}", job.id(), e.getMessage(), e);
            }
        }

        private void report(RebuildOutcome outcome) {
            try {
                listener.onCompleted(outcome);
            } catch (RuntimeException e) {
                log.warn("Rebuild listener failed on completion of {}: {}", outcome.job().id(), e.getMessage(), e);
            }
        }
    }
}
