package work.lcod.versioner.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.versioner.counter.CounterState;
import work.lcod.versioner.manifest.ManifestAccessor;
import work.lcod.versioner.manifest.ManifestException;
import work.lcod.versioner.manifest.UnitManifest;
import work.lcod.versioner.manifest.UnitVersion;
import work.lcod.versioner.registry.RegistryClient;
import work.lcod.versioner.registry.RegistryVersionRecord;
import work.lcod.versioner.summary.UnitResult;
import work.lcod.versioner.support.ScriptedCommandRunner;
import work.lcod.versioner.support.VersionerTestSupport;
import work.lcod.versioner.vcs.ChangeDetector;
import work.lcod.versioner.vcs.GitChangeDetector;

class VersionReconcilerTest {
    private static final Optional<String> NO_PUBLISHER = Optional.empty();
    private static final Optional<String> PUBLISHER = Optional.of("acme");

    @TempDir
    Path root;

    @Test
    void freshRepositoryForcedUpdateAssignsSequentialPatches() throws Exception {
        VersionerTestSupport.writeManifest(root, "unit-b", "1.0", null);
        VersionerTestSupport.writeManifest(root, "unit-a", "1.0", null);

        var result = reconciler(VersionerTestSupport.fixedChanges(false), unusedRegistry())
            .reconcile(loadAll(), CounterState.INITIAL, true, NO_PUBLISHER);

        assertEquals(new CounterState(3), result.counter());
        assertEquals(List.of("unit-a", "unit-b"), result.summary().units().stream().map(UnitResult::id).toList());
        assertEquals(new UnitVersion(1, 0, 1), reload("unit-a").version());
        assertEquals(new UnitVersion(1, 0, 2), reload("unit-b").version());
        assertEquals(Optional.of(VersionerTestSupport.HEAD), reload("unit-a").lastVersionCommit());
        assertEquals(Optional.of("2024-05-01T10:15:30Z"), reload("unit-a").lastVersionUpdate());
    }

    @Test
    void newCommitBumpsPastOwnPatch() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "2.3.10", VersionerTestSupport.OLD_COMMIT);

        var result = reconciler(VersionerTestSupport.fixedChanges(true), unusedRegistry())
            .reconcile(loadAll(), new CounterState(5), false, NO_PUBLISHER);

        assertEquals(new UnitVersion(2, 3, 11), reload("hub").version());
        assertEquals(new CounterState(12), result.counter());
        assertEquals(UnitState.UPDATED, result.summary().units().get(0).state());
    }

    @Test
    void publishedPatchOnSameLineIsExceeded() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "2.3.10", VersionerTestSupport.OLD_COMMIT);
        var registry = VersionerTestSupport.fixedRegistry(RegistryVersionRecord.published(UnitVersion.parse("2.3.15")));

        var result = reconciler(VersionerTestSupport.fixedChanges(true), registry)
            .reconcile(loadAll(), new CounterState(5), false, PUBLISHER);

        assertEquals(new UnitVersion(2, 3, 16), reload("hub").version());
        assertEquals(new CounterState(17), result.counter());
        var notes = result.summary().units().get(0).notes();
        assertTrue(notes.get(0).contains("patch raised to exceed registry version 2.3.15"), notes.toString());
    }

    @Test
    void publishedVersionOnAnotherMajorIsNotAFloor() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "2.3.10", VersionerTestSupport.OLD_COMMIT);
        var registry = VersionerTestSupport.fixedRegistry(RegistryVersionRecord.published(UnitVersion.parse("3.0.2")));

        reconciler(VersionerTestSupport.fixedChanges(true), registry)
            .reconcile(loadAll(), new CounterState(5), false, PUBLISHER);

        assertEquals(new UnitVersion(2, 3, 11), reload("hub").version());
    }

    @Test
    void unknownRegistryFallsBackToLocalFloorWithANote() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "2.3.10", VersionerTestSupport.OLD_COMMIT);
        var registry = VersionerTestSupport.fixedRegistry(RegistryVersionRecord.unknown("tfx exited with code 1"));

        var result = reconciler(VersionerTestSupport.fixedChanges(true), registry)
            .reconcile(loadAll(), new CounterState(5), false, PUBLISHER);

        assertEquals(new UnitVersion(2, 3, 11), reload("hub").version());
        assertTrue(result.summary().units().get(0).notes().get(0).startsWith("marketplace floor skipped"));
    }

    @Test
    void registryIsNotQueriedWithoutPublisherOrForSkippedUnits() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "1.0.3", VersionerTestSupport.OLD_COMMIT);
        List<String> queried = new ArrayList<>();
        RegistryClient registry = (publisher, unit) -> {
            queried.add(unit);
            return RegistryVersionRecord.notPublished();
        };

        reconciler(VersionerTestSupport.fixedChanges(true), registry).reconcile(loadAll(), CounterState.INITIAL, false, NO_PUBLISHER);
        reconciler(VersionerTestSupport.fixedChanges(false), registry).reconcile(loadAll(), CounterState.INITIAL, false, PUBLISHER);

        assertTrue(queried.isEmpty());
    }

    @Test
    void unchangedUnitStaysByteForByteIdenticalWhileOthersUpdate() throws Exception {
        Path quiet = VersionerTestSupport.writeManifest(root, "quiet", "1.0.4", VersionerTestSupport.OLD_COMMIT);
        VersionerTestSupport.writeManifest(root, "busy", "1.0.2", VersionerTestSupport.OLD_COMMIT);
        byte[] before = Files.readAllBytes(quiet);
        ChangeDetector onlyBusy = detector(paths -> paths.contains("apps/busy/"));

        var result = reconciler(onlyBusy, unusedRegistry()).reconcile(loadAll(), new CounterState(3), false, NO_PUBLISHER);

        assertEquals(1, result.summary().count(UnitState.UPDATED));
        assertEquals(1, result.summary().count(UnitState.SKIPPED));
        assertTrue(java.util.Arrays.equals(before, Files.readAllBytes(quiet)));
        assertEquals(new UnitVersion(1, 0, 3), reload("busy").version());
    }

    @Test
    void updatedUnitsNeverShareAPatch() throws Exception {
        for (String id : List.of("e", "d", "c", "b", "a")) {
            VersionerTestSupport.writeManifest(root, id, "1.0." + (id.charAt(0) - 'a') * 3, null);
        }

        var result = reconciler(VersionerTestSupport.fixedChanges(true), unusedRegistry())
            .reconcile(loadAll(), new CounterState(2), true, NO_PUBLISHER);

        Set<Integer> patches = new HashSet<>();
        for (UnitResult unit : result.summary().units()) {
            assertTrue(unit.newVersion().orElseThrow().compareTo(unit.oldVersion()) > 0);
            assertTrue(patches.add(unit.newVersion().orElseThrow().patch()), "duplicate patch " + unit);
        }
        assertTrue(result.counter().value() > patches.stream().mapToInt(Integer::intValue).max().orElseThrow());
    }

    @Test
    void secondRunWithoutCommitsIsANoOp() throws Exception {
        VersionerTestSupport.writeManifest(root, "a", "1.0", null);
        VersionerTestSupport.writeManifest(root, "b", "1.1", null);
        ChangeDetector sinceHead = new ChangeDetector() {
            @Override
            public boolean hasChanges(Set<String> trackedPaths, String since) {
                return !VersionerTestSupport.HEAD.equals(since);
            }

            @Override
            public Optional<String> headRevision() {
                return Optional.of(VersionerTestSupport.HEAD);
            }
        };

        var first = reconciler(sinceHead, unusedRegistry()).reconcile(loadAll(), CounterState.INITIAL, false, NO_PUBLISHER);
        var second = reconciler(sinceHead, unusedRegistry()).reconcile(loadAll(), first.counter(), false, NO_PUBLISHER);

        assertEquals(2, first.summary().count(UnitState.UPDATED));
        assertEquals(0, second.summary().count(UnitState.UPDATED));
        assertEquals(2, second.summary().count(UnitState.SKIPPED));
        assertEquals(first.counter(), second.counter());
    }

    @Test
    void failingGitStillUpdatesTheUnit() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "1.2.3", VersionerTestSupport.OLD_COMMIT);
        var runner = new ScriptedCommandRunner()
            .failing("git", "log", new java.io.IOException("Cannot run program \"git\""))
            .failing("git", "rev-parse", new java.io.IOException("Cannot run program \"git\""));

        var result = reconciler(new GitChangeDetector(runner, root), unusedRegistry())
            .reconcile(loadAll(), CounterState.INITIAL, false, NO_PUBLISHER);

        assertEquals(UnitState.UPDATED, result.summary().units().get(0).state());
        var reloaded = reload("hub");
        assertEquals(new UnitVersion(1, 2, 4), reloaded.version());
        assertTrue(reloaded.lastVersionCommit().isEmpty());
    }

    @Test
    void failedWriteAbortsWithoutAdvancingPastCommittedState() throws Exception {
        VersionerTestSupport.writeManifest(root, "a", "1.0", null);
        Path blocked = VersionerTestSupport.writeManifest(root, "b", "1.0", null);
        var units = loadAll();
        Files.delete(blocked);
        Files.createDirectories(blocked.resolve("occupied"));

        var thrown = assertThrows(
            ReconcileException.class,
            () -> reconciler(VersionerTestSupport.fixedChanges(true), unusedRegistry())
                .reconcile(units, CounterState.INITIAL, true, NO_PUBLISHER)
        );

        assertTrue(thrown.getMessage().contains("Unit b"));
        var partial = thrown.partialResult();
        assertEquals(new CounterState(2), partial.counter());
        assertTrue(partial.summary().aborted());
        assertEquals(List.of(UnitState.UPDATED, UnitState.FAILED),
            partial.summary().units().stream().map(UnitResult::state).toList());
        assertEquals(new UnitVersion(1, 0, 1), reload("a").version());
    }

    @Test
    void unusableFloorAbortsWithTheCommittedCounter() throws Exception {
        VersionerTestSupport.writeManifest(root, "a", "1.0", null);
        VersionerTestSupport.writeManifest(root, "b", "1.0", null);
        RegistryClient registry = (publisher, unitId) -> "b".equals(unitId)
            ? RegistryVersionRecord.published(new UnitVersion(1, 0, Integer.MAX_VALUE))
            : RegistryVersionRecord.notPublished();

        var thrown = assertThrows(
            ReconcileException.class,
            () -> reconciler(VersionerTestSupport.fixedChanges(true), registry)
                .reconcile(loadAll(), CounterState.INITIAL, true, PUBLISHER)
        );

        assertTrue(thrown.getMessage().startsWith("Unit b: processing failed"), thrown.getMessage());
        var partial = thrown.partialResult();
        assertEquals(new CounterState(2), partial.counter());
        assertEquals(List.of(UnitState.UPDATED, UnitState.FAILED),
            partial.summary().units().stream().map(UnitResult::state).toList());
        assertEquals(new UnitVersion(1, 0, 1), reload("a").version());
        assertEquals(new UnitVersion(1, 0, 0), reload("b").version());
    }

    @Test
    void duplicateIdsAreFatal() throws Exception {
        VersionerTestSupport.writeManifest(root, "hub", "1.0", null);
        var units = loadAll();
        var duplicated = new ArrayList<>(units);
        duplicated.addAll(units);

        assertThrows(
            ManifestException.class,
            () -> reconciler(VersionerTestSupport.fixedChanges(true), unusedRegistry())
                .reconcile(duplicated, CounterState.INITIAL, true, NO_PUBLISHER)
        );
        assertFalse(reload("hub").lastVersionCommit().isPresent());
    }

    private VersionReconciler reconciler(ChangeDetector changes, RegistryClient registry) {
        return new VersionReconciler(accessor(), changes, registry, VersionerTestSupport.fixedClock());
    }

    private ManifestAccessor accessor() {
        return new ManifestAccessor(root, "apps");
    }

    private List<UnitManifest> loadAll() {
        var accessor = accessor();
        return accessor.discover("azure-devops-extension-*.json").stream().map(accessor::load).toList();
    }

    private UnitManifest reload(String id) {
        return accessor().load(root.resolve("azure-devops-extension-" + id + ".json"));
    }

    private static RegistryClient unusedRegistry() {
        return (publisher, unit) -> {
            throw new AssertionError("registry must not be queried");
        };
    }

    private static ChangeDetector detector(java.util.function.Predicate<Set<String>> changed) {
        return new ChangeDetector() {
            @Override
            public boolean hasChanges(Set<String> trackedPaths, String since) {
                return changed.test(trackedPaths);
            }

            @Override
            public Optional<String> headRevision() {
                return Optional.of(VersionerTestSupport.HEAD);
            }
        };
    }
}
