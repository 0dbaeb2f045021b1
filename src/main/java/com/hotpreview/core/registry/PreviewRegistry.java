package com.hotpreview.core.registry;

import com.hotpreview.core.config.PreviewProperties;
import com.hotpreview.core.events.BroadcastHub;
import com.hotpreview.core.events.PreviewMessage;
import com.hotpreview.core.logging.MdcContext;
import com.hotpreview.core.metrics.PreviewMetrics;
import com.hotpreview.core.model.ChangeEvent;
import com.hotpreview.core.model.PreviewSession;
import com.hotpreview.core.model.Project;
import com.hotpreview.core.model.RebuildJob;
import com.hotpreview.core.model.RebuildOutcome;
import com.hotpreview.core.model.RebuildTrigger;
import com.hotpreview.core.model.SessionStatus;
import com.hotpreview.core.scheduler.ChangeDebouncer;
import com.hotpreview.core.scheduler.RebuildListener;
import com.hotpreview.core.scheduler.RebuildScheduler;
import com.hotpreview.core.security.AccessOperation;
import com.hotpreview.core.security.PermissionCheck;
import com.hotpreview.core.server.ProjectServer;
import com.hotpreview.core.server.ProjectServerFactory;
import com.hotpreview.core.server.ServerBinding;
import com.hotpreview.core.watch.ExcludeRules;
import com.hotpreview.core.watch.FileWatcher;
import com.hotpreview.core.watch.WatchException;
import com.hotpreview.core.watch.WatchListener;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every preview session and the only place their components are created or destroyed.
 * <p>
 * Registration wires watcher, debouncer, scheduler, server and broadcast group for one
 * project id. Mutations of one id are serialized on that id's entry, so concurrent
 * registrations of the same id yield one session and concurrent unregistrations free
 * resources once. Different ids never contend.
 */
@Service
public class PreviewRegistry {

    private static final Logger log = LoggerFactory.getLogger(PreviewRegistry.class);

    private final PreviewProperties properties;
    private final PermissionCheck permissionCheck;
    private final BroadcastHub hub;
    private final ChangeDebouncer debouncer;
    private final RebuildScheduler scheduler;
    private final ProjectServerFactory serverFactory;
    private final PreviewMetrics metrics;
    private final ExcludeRules excludeRules;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    @Autowired
    public PreviewRegistry(PreviewProperties properties,
                           PermissionCheck permissionCheck,
                           BroadcastHub hub,
                           ChangeDebouncer debouncer,
                           RebuildScheduler scheduler,
                           ProjectServerFactory serverFactory,
                           @Autowired(required = false) PreviewMetrics metrics) {
        this.properties = properties;
        this.permissionCheck = permissionCheck;
        this.hub = hub;
        this.debouncer = debouncer;
        this.scheduler = scheduler;
        this.serverFactory = serverFactory;
        this.metrics = metrics;
        this.excludeRules = ExcludeRules.from(properties.getWatch());
    }

    /**
     * Registers a project for preview, or returns the live session when the id is already
     * registered. Re-registration with the same root applies new proxy rules and compile
     * step, and restarts a watcher that failed.
     *
     * @throws ProjectConfigurationException if the root is unusable or differs from the registered one
     * @throws com.hotpreview.core.server.PortUnavailableException if no port can be bound (retryable)
     */
    public PreviewSession register(Project project) {
        Objects.requireNonNull(project, "project");
        String id = project.id();
        while (true) {
            Entry entry = entries.computeIfAbsent(id, Entry::new);
            synchronized (entry) {
                if (entry.removed) {
                    // lost a race with unregister; start over with a fresh entry
                    continue;
                }
                if (entry.started) {
                    recordRegistration("existing");
                    return reregister(entry, project);
                }
                try {
                    start(entry, project);
                } catch (RuntimeException e) {
                    entry.removed = true;
                    entries.remove(id, entry);
                    recordRegistration("failed");
                    throw e;
                }
                recordRegistration("created");
                // inside the entry lock so catalogue subscribers never see removed before added
                hub.publishGlobal(PreviewMessage.projectAdded(entry.session));
                return entry.session;
            }
        }
    }

    /**
     * Tears down a project: watcher, then debouncer and scheduler, then server and channels.
     *
     * @return {@code false} if the id was not registered (including a concurrent unregister that won)
     */
    public boolean unregister(String projectId) {
        Entry entry = entries.get(projectId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.removed) {
                return false;
            }
            entry.removed = true;
            if (!entry.started) {
                entries.remove(projectId, entry);
                return false;
            }
            tearDown(entry);
            entry.session = entry.session.stopped();
            // removed only after teardown so a re-registration cannot overlap it
            entries.remove(projectId, entry);
            hub.publishGlobal(PreviewMessage.projectRemoved(projectId));
        }
        log.info("Project {} unregistered", projectId);
        return true;
    }

    public PreviewSession get(String projectId) {
        Entry entry = entries.get(projectId);
        if (entry == null || entry.removed) {
            return null;
        }
        return entry.session;
    }

    /**
     * @throws ProjectNotFoundException if the id is not registered
     */
    public Project project(String projectId) {
        Entry entry = entries.get(projectId);
        if (entry == null || entry.removed || entry.project == null) {
            throw new ProjectNotFoundException(projectId);
        }
        return entry.project;
    }

    /**
     * Sessions ordered by start time; always reflects the last known status.
     */
    public List<PreviewSession> list() {
        List<PreviewSession> sessions = new ArrayList<>();
        for (Entry entry : entries.values()) {
            PreviewSession session = entry.session;
            if (!entry.removed && session != null) {
                sessions.add(session);
            }
        }
        sessions.sort(Comparator.comparing(PreviewSession::startedAt));
        return sessions;
    }

    /**
     * Queues a manual rebuild.
     *
     * @throws ProjectNotFoundException if the id is not registered
     */
    public void rebuild(String projectId) {
        if (get(projectId) == null || !scheduler.trigger(projectId, List.of(), RebuildTrigger.MANUAL)) {
            throw new ProjectNotFoundException(projectId);
        }
        log.info("Manual rebuild requested for project {}", projectId);
    }

    public long countByStatus(SessionStatus status) {
        return list().stream().filter(s -> s.status() == status).count();
    }

    @PreDestroy
    public void shutdown() {
        List<String> ids = new ArrayList<>(entries.keySet());
        if (!ids.isEmpty()) {
            log.info("Disposing {} preview session(s)", ids.size());
        }
        for (String id : ids) {
            try {
                unregister(id);
            } catch (RuntimeException e) {
                log.error("Failed to dispose project {}", id, e);
            }
        }
    }

    private void start(Entry entry, Project project) {
        String id = project.id();
        MdcContext.setProject(id);
        try {
            validateRoot(project.rootPath());
            entry.project = project;
            entry.session = PreviewSession.starting(project);

            hub.openProject(id);
            scheduler.register(project, new BroadcastingRebuildListener(id));
            debouncer.register(id, batch -> scheduler.trigger(id, batch, RebuildTrigger.FILE_CHANGE));

            entry.server = serverFactory.create();
            ServerBinding binding = entry.server.start(project);

            entry.watcher = newWatcher(entry);
            try {
                entry.watcher.start();
            } catch (WatchException e) {
                throw new ProjectConfigurationException(e.getMessage(), e);
            }

            entry.session = entry.session.ready(binding.port(), binding.baseUrl());
            entry.started = true;
            log.info("Project {} ({}) registered at {} serving {}", id, project.name(),
                    binding.baseUrl(), project.rootPath());
        } catch (RuntimeException e) {
            log.warn("Registration of project {} failed: {}", id, e.getMessage());
            tearDown(entry);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private PreviewSession reregister(Entry entry, Project update) {
        Project current = entry.project;
        if (!current.rootPath().equals(update.rootPath())) {
            throw new ProjectConfigurationException("Project " + current.id() + " is already registered with root "
                    + current.rootPath() + "; unregister it before changing the root");
        }
        Project merged = current.withSettingsFrom(update);
        if (!merged.equals(current)) {
            entry.project = merged;
            entry.server.updateProject(merged);
            scheduler.updateProject(merged);
            log.info("Project {} settings updated ({} proxy rule(s), compile step: {})", merged.id(),
                    merged.proxyRules().size(), merged.compileStepOpt().isPresent());
        }

        if (entry.session.status() == SessionStatus.ERROR) {
            log.info("Restarting watcher for project {}", merged.id());
            FileWatcher watcher = newWatcher(entry);
            try {
                watcher.start();
            } catch (WatchException e) {
                throw new ProjectConfigurationException(e.getMessage(), e);
            }
            entry.watcher = watcher;
            ServerBinding binding = entry.server.binding().orElseThrow();
            entry.session = entry.session.ready(binding.port(), binding.baseUrl());
        }
        return entry.session;
    }

    private void validateRoot(Path root) {
        if (!Files.isDirectory(root)) {
            throw new ProjectConfigurationException("Project root is not a directory: " + root);
        }
        if (!Files.isReadable(root)) {
            throw new ProjectConfigurationException("Project root is not readable: " + root);
        }
        if (!permissionCheck.canAccess(root, AccessOperation.WATCH)) {
            throw new ProjectConfigurationException("Access to project root is not permitted: " + root);
        }
    }

    private FileWatcher newWatcher(Entry entry) {
        return new FileWatcher(entry.id, entry.project.rootPath(), excludeRules,
                properties.getWatch().getSettleWindowMs(), permissionCheck, new SessionWatchListener(entry));
    }

    /**
     * Releases whatever parts of the entry exist. Each step runs even if an earlier one fails.
     */
    private void tearDown(Entry entry) {
        String id = entry.id;
        FileWatcher watcher = entry.watcher;
        if (watcher != null) {
            runQuietly(id, "stop watcher", watcher::stop);
        }
        runQuietly(id, "cancel debounce", () -> debouncer.cancel(id));
        runQuietly(id, "cancel rebuilds", () -> scheduler.cancel(id));
        ProjectServer server = entry.server;
        if (server != null) {
            runQuietly(id, "stop server", server::stop);
        }
        runQuietly(id, "close channels", () -> hub.closeProject(id, PreviewMessage.projectRemoved(id)));
        entry.watcher = null;
        entry.server = null;
    }

    private static void runQuietly(String projectId, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.error("Teardown step '{}' failed for project {}", step, projectId, e);
        }
    }

    private void recordRegistration(String result) {
        if (metrics != null) {
            metrics.recordRegistration(result);
        }
    }

    private static final class Entry {
        private final String id;
        private volatile Project project;
        private volatile PreviewSession session;
        private FileWatcher watcher;
        private ProjectServer server;
        private volatile boolean started;
        private volatile boolean removed;

        Entry(String id) {
            this.id = id;
        }
    }

    private final class SessionWatchListener implements WatchListener {
        private final Entry entry;

        SessionWatchListener(Entry entry) {
            this.entry = entry;
        }

        @Override
        public void onChange(ChangeEvent event) {
            if (entry.removed) {
                return;
            }
            if (metrics != null) {
                metrics.recordWatchEvent(event.kind().wireName());
            }
            hub.publish(entry.id, PreviewMessage.fileChange(event));
            debouncer.onEvent(event);
        }

        @Override
        public void onError(String projectId, WatchException error) {
            synchronized (entry) {
                if (entry.removed) {
                    return;
                }
                PreviewSession current = entry.session;
                if (current != null) {
                    entry.session = current.error(error.getMessage());
                }
            }
            if (metrics != null) {
                metrics.recordWatchError();
            }
            log.warn("Project {} stopped watching: {}", projectId, error.getMessage());
            hub.publish(projectId, PreviewMessage.watcherError(projectId, error.getMessage()));
        }
    }

    private final class BroadcastingRebuildListener implements RebuildListener {
        private final String projectId;

        BroadcastingRebuildListener(String projectId) {
            this.projectId = projectId;
        }

        @Override
        public void onStarted(RebuildJob job) {
            hub.publish(projectId, PreviewMessage.rebuildStarted(job));
        }

        @Override
        public void onCompleted(RebuildOutcome outcome) {
            hub.publish(projectId, outcome.succeeded()
                    ? PreviewMessage.rebuildComplete(outcome)
                    : PreviewMessage.rebuildError(outcome));
        }
    }
}
