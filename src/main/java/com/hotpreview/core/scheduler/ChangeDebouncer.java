package com.hotpreview.core.scheduler;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.logging.MdcContext;
import com.hotpreview.core.model.ChangeEvent;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Sliding-window debounce of change events, scoped per project.
 * <p>
 * Every event for a project re-arms that project's single timer; once the window passes
 * with no further events the accumulated batch is handed to the project's callback and
 * cleared. Projects never share or reset each other's windows. Callbacks run on the shared
 * timer thread and must not block.
 */
@Service
public class ChangeDebouncer {

    private static final Logger log = LoggerFactory.getLogger(ChangeDebouncer.class);

    private final long windowMs;
    private final ConcurrentHashMap<String, ProjectWindow> windows = new ConcurrentHashMap<>();

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "change-debouncer");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ChangeDebouncer(PreviewProperties properties) {
        this(properties.getDebounce().getWindowMs());
    }

    public ChangeDebouncer(long windowMs) {
        if (windowMs < 0) {
            throw new IllegalArgumentException("debounce window must be >= 0");
        }
        this.windowMs = windowMs;
    }

    /**
     * Installs the rebuild-trigger callback for a project, replacing any previous one.
     */
    public void register(String projectId, Consumer<List<ChangeEvent>> onBatch) {
        ProjectWindow previous = windows.put(projectId, new ProjectWindow(projectId, onBatch));
        if (previous != null) {
            previous.discard();
        }
    }

    /**
     * Adds an event to its project's batch and restarts the window. Events for projects
     * that are not registered are dropped.
     */
    public void onEvent(ChangeEvent event) {
        ProjectWindow window = windows.get(event.projectId());
        if (window == null) {
            log.debug("Dropping change {} for unregistered project {}", event.relativePath(), event.projectId());
            return;
        }
        window.add(event);
    }

    /**
     * Removes a project, discarding its pending batch without firing.
     */
    public void cancel(String projectId) {
        ProjectWindow window = windows.remove(projectId);
        if (window != null) {
            int discarded = window.discard();
            if (discarded > 0) {
                log.debug("Discarded {} pending change(s) for project {}", discarded, projectId);
            }
        }
    }

    public int pendingCount(String projectId) {
        ProjectWindow window = windows.get(projectId);
        return window == null ? 0 : window.size();
    }

    public long windowMs() {
        return windowMs;
    }

    @PreDestroy
    public void shutdown() {
        for (String projectId : new ArrayList<>(windows.keySet())) {
            cancel(projectId);
        }
        timer.shutdownNow();
    }

    private final class ProjectWindow {
        private final String projectId;
        private final Consumer<List<ChangeEvent>> onBatch;
        private final List<ChangeEvent> batch = new ArrayList<>();
        private ScheduledFuture<?> pendingFlush;
        private long generation;
        private boolean discarded;

        ProjectWindow(String projectId, Consumer<List<ChangeEvent>> onBatch) {
            this.projectId = projectId;
            this.onBatch = onBatch;
        }

        synchronized void add(ChangeEvent event) {
            if (discarded) {
                return;
            }
            batch.add(event);
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
            }
            long scheduledGeneration = ++generation;
            pendingFlush = timer.schedule(() -> flush(scheduledGeneration), windowMs, TimeUnit.MILLISECONDS);
        }

        synchronized int size() {
            return batch.size();
        }

        synchronized int discard() {
            discarded = true;
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
            int count = batch.size();
            batch.clear();
            return count;
        }

        private void flush(long scheduledGeneration) {
            List<ChangeEvent> events;
            synchronized (this) {
                // a newer event re-armed the window after this flush was queued
                if (discarded || scheduledGeneration != generation || batch.isEmpty()) {
                    return;
                }
                events = List.copyOf(batch);
                batch.clear();
                pendingFlush = null;
            }
            MdcContext.setProject(projectId);
            try {
                log.debug("Debounce window closed for project {} with {} event(s)", projectId, events.size());
                onBatch.accept(events);
            } catch (RuntimeException e) {
                log.warn("Rebuild trigger for project {} failed: {}", projectId, e.getMessage(), e);
            } finally {
                MdcContext.clear();
            }
        }
    }
}
