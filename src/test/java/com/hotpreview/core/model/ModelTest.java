package com.hotpreview.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    private static ChangeEvent change(String path, ChangeKind kind) {
        return new ChangeEvent("p1", path, kind, Instant.now());
    }

    @Nested
    @DisplayName("ChangeKind")
    class ChangeKindTests {

        @Test
        @DisplayName("added then modified stays added")
        void addedThenModified() {
            assertEquals(ChangeKind.ADDED, ChangeKind.ADDED.followedBy(ChangeKind.MODIFIED));
        }

        @Test
        @DisplayName("added then removed cancels out")
        void addedThenRemoved() {
            assertNull(ChangeKind.ADDED.followedBy(ChangeKind.REMOVED));
        }

        @Test
        @DisplayName("removed then added becomes modified")
        void removedThenAdded() {
            assertEquals(ChangeKind.MODIFIED, ChangeKind.REMOVED.followedBy(ChangeKind.ADDED));
        }

        @Test
        @DisplayName("modified then removed is removed")
        void modifiedThenRemoved() {
            assertEquals(ChangeKind.REMOVED, ChangeKind.MODIFIED.followedBy(ChangeKind.REMOVED));
        }
    }

    @Nested
    @DisplayName("Project")
    class ProjectTests {

        @Test
        @DisplayName("normalizes the root and defaults the name to the id")
        void normalizesRootAndName() {
            var project = new Project("p1", " ", Path.of("/tmp/site/../site"), null, null, null);
            assertEquals(Path.of("/tmp/site"), project.rootPath());
            assertEquals("p1", project.name());
            assertTrue(project.proxyRules().isEmpty());
            assertNotNull(project.registeredAt());
            assertTrue(project.compileStepOpt().isEmpty());
        }

        @Test
        @DisplayName("generated ids are prefixed and unique")
        void generatedIds() {
            String a = Project.generateId();
            String b = Project.generateId();
            assertTrue(a.startsWith("prj-"));
            assertNotEquals(a, b);
        }

        @Test
        @DisplayName("withSettingsFrom keeps identity and takes rules and compile step")
        void withSettingsFrom() {
            Instant registered = Instant.parse("2026-01-01T00:00:00Z");
            var original = new Project("p1", "Site", Path.of("/tmp/site"), List.of(), null, registered);
            var update = new Project("p1", "Other", Path.of("/tmp/site"),
                    List.of(new ProxyRule("/api", "http://localhost:3000")), new CompileStep("npx tsc"), null);

            var merged = original.withSettingsFrom(update);

            assertEquals("Site", merged.name());
            assertEquals(registered, merged.registeredAt());
            assertEquals(1, merged.proxyRules().size());
            assertEquals("npx tsc", merged.compileStep().command());
        }
    }

    @Nested
    @DisplayName("ProxyRule and CompileStep")
    class DescriptorTests {

        @Test
        @DisplayName("proxy prefix gains a leading slash")
        void proxyPrefixSlash() {
            var rule = new ProxyRule("api", "http://localhost:3000");
            assertEquals("/api", rule.matchPrefix());
            assertTrue(rule.matches("/api/users"));
            assertFalse(rule.matches("/static/app.js"));
        }

        @Test
        @DisplayName("blank compile command is rejected")
        void blankCommandRejected() {
            assertThrows(IllegalArgumentException.class, () -> new CompileStep("  "));
        }

        @Test
        @DisplayName("working dir resolves against the project root")
        void workingDirResolution() {
            Path root = Path.of("/tmp/site");
            assertEquals(root, new CompileStep("make").resolveWorkingDir(root));
            assertEquals(Path.of("/tmp/site/web"),
                    new CompileStep("make", Path.of("web"), 0).resolveWorkingDir(root));
            assertEquals(Path.of("/opt/build"),
                    new CompileStep("make", Path.of("/opt/build"), 0).resolveWorkingDir(root));
        }
    }

    @Nested
    @DisplayName("RebuildJob")
    class RebuildJobTests {

        @Test
        @DisplayName("file-change job requires at least one event")
        void fileChangeNeedsEvents() {
            assertThrows(IllegalArgumentException.class,
                    () -> RebuildJob.queued("p1", RebuildTrigger.FILE_CHANGE, List.of()));
        }

        @Test
        @DisplayName("manual job may be empty")
        void manualMayBeEmpty() {
            var job = RebuildJob.queued("p1", RebuildTrigger.MANUAL, List.of());
            assertEquals(RebuildStatus.QUEUED, job.status());
            assertTrue(job.triggeringEvents().isEmpty());
        }

        @Test
        @DisplayName("merging appends events and keeps the job id")
        void mergeAppends() {
            var job = RebuildJob.queued("p1", RebuildTrigger.FILE_CHANGE,
                    List.of(change("a.txt", ChangeKind.MODIFIED)));
            var merged = job.mergedWith(List.of(change("b.txt", ChangeKind.ADDED),
                    change("a.txt", ChangeKind.MODIFIED)), RebuildTrigger.FILE_CHANGE);

            assertEquals(job.id(), merged.id());
            assertEquals(3, merged.triggeringEvents().size());
            assertEquals(List.of("a.txt", "b.txt"), merged.affectedPaths());
        }

        @Test
        @DisplayName("manual job merged with file changes becomes a file-change job")
        void manualMergedWithChanges() {
            var job = RebuildJob.queued("p1", RebuildTrigger.MANUAL, List.of());
            var merged = job.mergedWith(List.of(change("a.txt", ChangeKind.MODIFIED)), RebuildTrigger.FILE_CHANGE);
            assertEquals(RebuildTrigger.FILE_CHANGE, merged.trigger());
        }

        @Test
        @DisplayName("transitions stamp times and terminal status")
        void transitions() {
            var running = RebuildJob.queued("p1", RebuildTrigger.MANUAL, List.of()).running();
            assertEquals(RebuildStatus.RUNNING, running.status());
            assertNotNull(running.startedAt());
            assertFalse(running.status().isTerminal());

            var failed = running.failed("boom", true);
            assertEquals(RebuildStatus.FAILED, failed.status());
            assertEquals("boom", failed.error());
            assertTrue(failed.timedOut());
            assertNotNull(failed.finishedAt());
            assertTrue(failed.status().isTerminal());

            var outcome = new RebuildOutcome("p1", running.succeeded(), Duration.ofMillis(5));
            assertTrue(outcome.succeeded());
        }
    }

    @Nested
    @DisplayName("PreviewSession")
    class PreviewSessionTests {

        @Test
        @DisplayName("moves from starting to ready to error to stopped")
        void lifecycle() {
            var session = PreviewSession.starting(Project.of("p1", "Site", Path.of("/tmp/site")));
            assertEquals(SessionStatus.STARTING, session.status());
            assertNull(session.baseUrl());

            var ready = session.ready(4321, "http://localhost:4321/");
            assertEquals(SessionStatus.READY, ready.status());
            assertEquals(4321, ready.port());

            var error = ready.error("root gone");
            assertEquals(SessionStatus.ERROR, error.status());
            assertEquals("root gone", error.lastError());
            assertEquals(4321, error.port());

            assertEquals(SessionStatus.STOPPED, error.stopped().status());
            assertEquals(session.startedAt(), error.stopped().startedAt());
        }
    }
}
