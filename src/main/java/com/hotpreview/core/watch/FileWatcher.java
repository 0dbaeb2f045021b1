package com.hotpreview.core.watch;

import com.hotpreview.core.logging.MdcContext;
import com.hotpreview.core.model.ChangeEvent;
import com.hotpreview.core.model.ChangeKind;
import com.hotpreview.core.security.AccessOperation;
import com.hotpreview.core.security.PermissionCheck;
import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryChangeListener;
import io.methvin.watcher.DirectoryWatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recursive watcher over one project root, built on {@link DirectoryWatcher}
 * (inotify on Linux, FSEvents on macOS).
 * <p>
 * Raw events are filtered through {@link ExcludeRules}, then held per path until the path has
 * been quiet for the settle window, so a burst of writes to one file becomes a single
 * {@code modified} event. Removals are emitted without waiting.
 * <p>
 * Threads: the directory watcher's event loop runs on its own thread; a single emitter thread
 * runs settle timers and invokes the {@link WatchListener}, which gives listeners observation
 * order. If the root itself becomes inaccessible the watcher reports a terminal error and stops.
 */
public class FileWatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FileWatcher.class);

    private static final long ROOT_CHECK_INTERVAL_MS = 1000;

    private final String projectId;
    private final Path root;
    private final ExcludeRules excludeRules;
    private final long settleWindowMs;
    private final PermissionCheck permissionCheck;
    private final WatchListener listener;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object pendingLock = new Object();
    private final Map<String, Pending> pending = new HashMap<>();

    private Path realRoot;
    private DirectoryWatcher directoryWatcher;
    private ExecutorService eventLoop;
    private ScheduledExecutorService emitter;

    public FileWatcher(String projectId, Path root, ExcludeRules excludeRules, long settleWindowMs,
                       PermissionCheck permissionCheck, WatchListener listener) {
        this.projectId = projectId;
        this.root = root.toAbsolutePath().normalize();
        this.excludeRules = excludeRules;
        this.settleWindowMs = settleWindowMs;
        this.permissionCheck = permissionCheck;
        this.listener = listener;
    }

    /**
     * Registers the directory tree and starts the event loop. Returns once the tree is registered.
     *
     * @throws WatchException if the root is not a readable directory or cannot be registered
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Watcher for project {} already running", projectId);
            return;
        }
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            running.set(false);
            throw new WatchException("Project root is not a readable directory: " + root);
        }
        try {
            realRoot = root.toRealPath();
        } catch (IOException e) {
            realRoot = root;
        }

        emitter = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(() -> {
                MdcContext.setProject(projectId);
                r.run();
            }, "watch-" + projectId + "-emit");
            t.setDaemon(true);
            return t;
        });
        eventLoop = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(() -> {
                MdcContext.setProject(projectId);
                r.run();
            }, "watch-" + projectId);
            t.setDaemon(true);
            return t;
        });

        CompletableFuture<Void> loop;
        try {
            directoryWatcher = DirectoryWatcher.builder()
                    .path(root)
                    .listener(new Listener())
                    .fileHashing(false)
                    .logger(log)
                    .build();
            // registers the tree on this thread before the loop is handed to the executor
            loop = directoryWatcher.watchAsync(eventLoop);
        } catch (IOException e) {
            abortStart();
            throw new WatchException("Cannot watch " + root + ": " + e.getMessage(), e);
        }
        if (loop.isCompletedExceptionally()) {
            Throwable cause = causeOf(loop);
            abortStart();
            throw new WatchException("Cannot watch " + root + ": " + cause.getMessage(), cause);
        }
        loop.whenComplete((ignored, error) -> {
            if (running.get()) {
                fail("Project root is no longer accessible: " + root, error);
            }
        });
        emitter.scheduleWithFixedDelay(this::checkRoot, ROOT_CHECK_INTERVAL_MS, ROOT_CHECK_INTERVAL_MS,
                TimeUnit.MILLISECONDS);
        log.info("Watching {} for project {} (settle={}ms)", root, projectId, settleWindowMs);
    }

    /**
     * Stops watching and discards events that have not been emitted yet. Idempotent.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        closeDirectoryWatcher();
        discardPending();
        emitter.shutdownNow();
        eventLoop.shutdownNow();
        log.info("Watcher stopped for project {}", projectId);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public Path root() {
        return root;
    }

    private void handleEvent(DirectoryChangeEvent event) {
        if (!running.get()) {
            return;
        }
        if (event.eventType() == DirectoryChangeEvent.EventType.OVERFLOW) {
            log.warn("Watch event overflow for project {}; some changes may be missed", projectId);
            return;
        }
        Path path = event.path();
        Path relative = relativize(path);
        if (relative == null || relative.toString().isEmpty() || excludeRules.isExcluded(relative)) {
            return;
        }

        switch (event.eventType()) {
            case CREATE -> {
                if (!isDirectory(event, path) && mayWatch(path)) {
                    observe(relative, ChangeKind.ADDED);
                }
            }
            case MODIFY -> {
                if (!isDirectory(event, path) && mayWatch(path)) {
                    observe(relative, ChangeKind.MODIFIED);
                }
            }
            case DELETE -> {
                observe(relative, ChangeKind.REMOVED);
                if (!Files.isDirectory(root)) {
                    fail("Project root is no longer accessible: " + root, null);
                }
            }
            default -> log.debug("Ignoring {} for {}", event.eventType(), path);
        }
    }

    private Path relativize(Path path) {
        if (path.startsWith(root)) {
            return root.relativize(path);
        }
        if (path.startsWith(realRoot)) {
            return realRoot.relativize(path);
        }
        log.debug("Ignoring event outside project root: {}", path);
        return null;
    }

    private static boolean isDirectory(DirectoryChangeEvent event, Path path) {
        return event.isDirectory() || Files.isDirectory(path);
    }

    private boolean mayWatch(Path file) {
        Path dir = file.getParent() == null ? root : file.getParent();
        if (permissionCheck.canAccess(dir, AccessOperation.WATCH)) {
            return true;
        }
        log.debug("Not reporting {}: permission denied", file);
        return false;
    }

    private void checkRoot() {
        if (running.get() && !Files.isDirectory(root)) {
            fail("Project root is no longer accessible: " + root, null);
        }
    }

    /**
     * Folds a raw observation into the pending entry for its path and (re)arms its settle timer.
     */
    private void observe(Path relative, ChangeKind kind) {
        String path = toWirePath(relative);
        synchronized (pendingLock) {
            if (!running.get()) {
                return;
            }
            Pending previous = pending.remove(path);
            ChangeKind combined = kind;
            if (previous != null) {
                previous.future.cancel(false);
                combined = previous.kind.followedBy(kind);
            }
            if (combined == null) {
                log.debug("{} created and removed within settle window, ignoring", path);
                return;
            }
            long delay = combined == ChangeKind.REMOVED ? 0 : settleWindowMs;
            Pending next = new Pending(combined);
            pending.put(path, next);
            next.future = emitter.schedule(() -> emit(path, next), delay, TimeUnit.MILLISECONDS);
        }
    }

    private void emit(String path, Pending entry) {
        synchronized (pendingLock) {
            if (!running.get() || pending.get(path) != entry) {
                return;
            }
            pending.remove(path);
        }
        var event = new ChangeEvent(projectId, path, entry.kind, Instant.now());
        log.debug("Change {} {}", event.kind().wireName(), path);
        try {
            listener.onChange(event);
        } catch (RuntimeException e) {
            log.warn("Change listener failed for {}: {}", path, e.getMessage(), e);
        }
    }

    private void fail(String message, Throwable cause) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        closeDirectoryWatcher();
        discardPending();
        eventLoop.shutdown();
        WatchException error = cause == null ? new WatchException(message) : new WatchException(message, cause);
        log.warn("Watcher for project {} failed: {}", projectId, message);
        emitter.execute(() -> {
            try {
                listener.onError(projectId, error);
            } catch (RuntimeException e) {
                log.warn("Watch error listener failed: {}", e.getMessage(), e);
            }
        });
        emitter.shutdown();
    }

    private void abortStart() {
        running.set(false);
        closeDirectoryWatcher();
        emitter.shutdownNow();
        eventLoop.shutdownNow();
    }

    private void discardPending() {
        synchronized (pendingLock) {
            for (Pending entry : pending.values()) {
                if (entry.future != null) {
                    entry.future.cancel(false);
                }
            }
            pending.clear();
        }
    }

    private void closeDirectoryWatcher() {
        if (directoryWatcher == null) {
            return;
        }
        try {
            directoryWatcher.close();
        } catch (IOException e) {
            log.warn("Error closing directory watcher for project {}", projectId, e);
        }
    }

    private static Throwable causeOf(CompletableFuture<?> failed) {
        try {
            failed.get();
            return new IllegalStateException("watcher did not start");
        } catch (ExecutionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        }
    }

    static String toWirePath(Path relative) {
        return relative.toString().replace('\\', '/');
    }

    private final class Listener implements DirectoryChangeListener {

        @Override
        public void onEvent(DirectoryChangeEvent event) {
            handleEvent(event);
        }

        @Override
        public boolean isWatching() {
            return running.get();
        }

        @Override
        public void onException(Exception e) {
            log.warn("Directory watcher error for project {}: {}", projectId, e.getMessage());
        }
    }

    private static final class Pending {
        private final ChangeKind kind;
        private ScheduledFuture<?> future;

        Pending(ChangeKind kind) {
            this.kind = kind;
        }
    }
}
