package com.hotpreview.core.watch;

import com.hotpreview.core.model.ChangeEvent;
import com.hotpreview.core.model.ChangeKind;
import com.hotpreview.core.security.PermissionCheck;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileWatcherTest {

    private static final long SETTLE_MS = 50;

    @TempDir
    Path tempDir;

    private FileWatcher watcher;
    private final List<ChangeEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicReference<WatchException> error = new AtomicReference<>();
    private final CountDownLatch errorLatch = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.stop();
        }
    }

    private FileWatcher startWatcher(Path root) {
        return startWatcher(root, PermissionCheck.ALLOW_ALL);
    }

    private FileWatcher startWatcher(Path root, PermissionCheck permissionCheck) {
        watcher = new FileWatcher("p1", root, ExcludeRules.defaults(), SETTLE_MS, permissionCheck,
                new WatchListener() {
                    @Override
                    public void onChange(ChangeEvent event) {
                        events.add(event);
                    }

                    @Override
                    public void onError(String projectId, WatchException e) {
                        error.set(e);
                        errorLatch.countDown();
                    }
                });
        watcher.start();
        return watcher;
    }

    private void awaitEvents(int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (events.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("a burst of writes to one file becomes one modified event")
    void burstCoalesced() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "v0");
        startWatcher(tempDir);

        Files.writeString(file, "v1");
        Files.writeString(file, "v2");
        Files.writeString(file, "v3");
        awaitEvents(1);
        Thread.sleep(SETTLE_MS * 4);

        assertEquals(1, events.size());
        ChangeEvent event = events.get(0);
        assertEquals("p1", event.projectId());
        assertEquals("a.txt", event.relativePath());
        assertEquals(ChangeKind.MODIFIED, event.kind());
    }

    @Test
    @DisplayName("excluded paths produce no events")
    void excludedPathsIgnored() throws Exception {
        Files.createDirectories(tempDir.resolve("node_modules"));
        startWatcher(tempDir);

        Files.writeString(tempDir.resolve("node_modules/dep.js"), "x");
        Files.writeString(tempDir.resolve("scratch.tmp"), "x");
        Files.writeString(tempDir.resolve(".env"), "x");
        Files.writeString(tempDir.resolve("index.html"), "<html></html>");
        awaitEvents(1);
        Thread.sleep(SETTLE_MS * 4);

        assertEquals(List.of("index.html"), events.stream().map(ChangeEvent::relativePath).toList());
        assertEquals(ChangeKind.ADDED, events.get(0).kind());
    }

    @Test
    @DisplayName("changes in directories refused by the permission check are not reported")
    void refusedDirectoriesIgnored() throws Exception {
        Path secrets = Files.createDirectories(tempDir.resolve("secrets"));
        startWatcher(tempDir, (path, op) -> !path.endsWith("secrets"));

        Files.writeString(secrets.resolve("key.pem"), "x");
        Files.writeString(tempDir.resolve("app.js"), "x");
        awaitEvents(1);
        Thread.sleep(SETTLE_MS * 4);

        assertEquals(List.of("app.js"), events.stream().map(ChangeEvent::relativePath).toList());
    }

    @Test
    @DisplayName("files in a newly created directory are reported with slash separated paths")
    void newDirectoryWatched() throws Exception {
        startWatcher(tempDir);

        Path sub = Files.createDirectories(tempDir.resolve("src/components"));
        Files.writeString(sub.resolve("App.js"), "export default 1;");
        awaitEvents(1);
        Thread.sleep(SETTLE_MS * 4);

        assertTrue(events.stream().anyMatch(e ->
                e.relativePath().equals("src/components/App.js") && e.kind() == ChangeKind.ADDED));
    }

    @Test
    @DisplayName("deletions are reported as removed")
    void deletionReported() throws Exception {
        Path file = Files.writeString(tempDir.resolve("old.css"), "body{}");
        startWatcher(tempDir);

        Files.delete(file);
        awaitEvents(1);

        assertEquals("old.css", events.get(0).relativePath());
        assertEquals(ChangeKind.REMOVED, events.get(0).kind());
    }

    @Test
    @DisplayName("deleting the root stops the watcher with a terminal error")
    void rootDeletionIsTerminal() throws Exception {
        Path root = Files.createDirectories(tempDir.resolve("site"));
        Files.writeString(root.resolve("index.html"), "<html></html>");
        startWatcher(root);

        deleteTree(root);

        assertTrue(errorLatch.await(5, TimeUnit.SECONDS));
        assertNotNull(error.get());
        assertFalse(watcher.isRunning());
    }

    @Test
    @DisplayName("start fails for a root that is not a directory")
    void startFailsForMissingRoot() {
        var missing = new FileWatcher("p1", tempDir.resolve("missing"), ExcludeRules.defaults(), SETTLE_MS,
                PermissionCheck.ALLOW_ALL, new WatchListener() {
                    @Override
                    public void onChange(ChangeEvent event) {
                    }

                    @Override
                    public void onError(String projectId, WatchException e) {
                    }
                });
        assertThrows(WatchException.class, missing::start);
        assertFalse(missing.isRunning());
    }

    @Test
    @DisplayName("nothing is emitted after stop")
    void noEventsAfterStop() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.txt"), "v0");
        startWatcher(tempDir);

        Files.writeString(file, "v1");
        watcher.stop();
        watcher.stop();
        Thread.sleep(SETTLE_MS * 4);

        assertTrue(events.isEmpty());
        assertFalse(watcher.isRunning());
    }

    @Test
    @DisplayName("toWirePath always uses forward slashes")
    void wirePath() {
        assertEquals("a/b/c.js", FileWatcher.toWirePath(Path.of("a", "b", "c.js")));
    }

    private static void deleteTree(Path root) throws IOException {
        try (Stream<Path> paths = Files.walk(root)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }
}
