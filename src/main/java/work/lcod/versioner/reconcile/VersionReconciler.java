package work.lcod.versioner.reconcile;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.versioner.counter.CounterState;
import work.lcod.versioner.manifest.ManifestAccessor;
import work.lcod.versioner.manifest.ManifestException;
import work.lcod.versioner.manifest.UnitManifest;
import work.lcod.versioner.manifest.UnitVersion;
import work.lcod.versioner.registry.RegistryClient;
import work.lcod.versioner.registry.RegistryVersionRecord;
import work.lcod.versioner.summary.RunSummary;
import work.lcod.versioner.summary.UnitResult;
import work.lcod.versioner.vcs.ChangeDetector;
import work.lcod.versioner.vcs.ChangeRecord;

/**
 * Assigns new patch versions to changed units, one unit at a time in ascending id order.
 *
 * <p>The counter is passed in and handed back; persisting it is the caller's job. A manifest is
 * saved before the counter advances past its patch, and a failed save aborts the run, so the
 * returned counter never runs ahead of what is on disk.
 */
public final class VersionReconciler {
    private static final Logger log = LoggerFactory.getLogger(VersionReconciler.class);

    private final ManifestAccessor manifests;
    private final ChangeDetector changes;
    private final RegistryClient registry;
    private final Clock clock;

    public VersionReconciler(ManifestAccessor manifests, ChangeDetector changes, RegistryClient registry, Clock clock) {
        this.manifests = Objects.requireNonNull(manifests, "manifests");
        this.changes = Objects.requireNonNull(changes, "changes");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ReconcileResult reconcile(
        List<UnitManifest> units,
        CounterState counter,
        boolean forceUpdate,
        Optional<String> publisherId
    ) {
        Objects.requireNonNull(counter, "counter");
        Instant startedAt = clock.instant();
        List<UnitManifest> ordered = inProcessingOrder(units);
        if (publisherId.isEmpty()) {
            log.info("No publisher ID provided; marketplace floor checks are disabled");
        }

        CounterState initial = counter;
        CounterState current = counter;
        List<UnitResult> results = new ArrayList<>();
        for (UnitManifest unit : ordered) {
            try {
                current = process(unit, current, forceUpdate, publisherId, results);
            } catch (RuntimeException ex) {
                boolean writeFailed = ex instanceof ManifestException;
                results.add(UnitResult.failed(
                    unit.id(),
                    unit.version(),
                    (writeFailed ? "manifest write failed: " : "processing failed: ") + ex.getMessage()
                ));
                RunSummary partial = new RunSummary(results, initial.value(), current.value(), true, startedAt, clock.instant());
                throw new ReconcileException(
                    "Unit " + unit.id() + ": " + (writeFailed ? "manifest could not be written" : "processing failed")
                        + ", counter left at " + current.value()
                        + " so it does not run ahead of persisted versions (" + ex.getMessage() + ")",
                    new ReconcileResult(partial, current),
                    ex
                );
            }
        }

        RunSummary summary = new RunSummary(results, initial.value(), current.value(), false, startedAt, clock.instant());
        return new ReconcileResult(summary, current);
    }

    /**
     * Runs one unit through detection, floor and save, recording its outcome. Returns the counter
     * after the unit; it only moves once the manifest is on disk.
     */
    private CounterState process(
        UnitManifest unit,
        CounterState current,
        boolean forceUpdate,
        Optional<String> publisherId,
        List<UnitResult> results
    ) {
        ChangeRecord change = forceUpdate
            ? new ChangeRecord(true, changes.headRevision())
            : changes.detect(unit.trackedPaths(), unit.lastVersionCommit().orElse(null));
        if (!change.hasChanges()) {
            log.info("Skipping {} ({}): no changes since {}", unit.id(), unit.version(), unit.lastVersionCommit().orElse("?"));
            results.add(UnitResult.skipped(unit.id(), unit.version(), "no changes"));
            return current;
        }

        List<String> notes = new ArrayList<>();
        Optional<RegistryVersionRecord> published = publisherId.map(publisher -> lookup(publisher, unit, notes));
        PatchFloor.Decision decision = PatchFloor.decide(unit.version(), current, published);
        if (decision.patch() == Integer.MAX_VALUE) {
            throw new IllegalStateException("patch " + decision.patch() + " leaves no room for the counter to advance");
        }
        if (decision.raisedByRegistry()) {
            String note = "patch raised to exceed registry version " + published.flatMap(RegistryVersionRecord::version).orElseThrow();
            log.warn("{}: {} (local floor was {})", unit.id(), note, decision.localFloor());
            notes.add(note);
        }

        UnitVersion newVersion = unit.version().withPatch(decision.patch());
        UnitManifest updated = unit.withNewVersion(newVersion, change.headRevision(), clock.instant());
        log.info("Updating {}", unit.path());
        log.info("  Version: {} → {}", unit.version(), newVersion);
        log.info("  - Patch: {} ({} floor)", decision.patch(), decision.dominant().name().toLowerCase());
        log.info("  - Tracked paths: {}", String.join(", ", unit.trackedPaths()));

        manifests.save(unit.path(), updated);
        results.add(UnitResult.updated(unit.id(), unit.version(), newVersion, notes));
        return current.advancePast(decision.patch());
    }

    private RegistryVersionRecord lookup(String publisherId, UnitManifest unit, List<String> notes) {
        RegistryVersionRecord record = registry.lookup(publisherId, unit.id());
        switch (record.kind()) {
            case UNKNOWN -> {
                log.warn("{}: marketplace version unknown ({}); marketplace floor protection skipped", unit.id(), record.detail());
                notes.add("marketplace floor skipped: " + record.detail());
            }
            case NOT_PUBLISHED -> log.info("{}: not published on the marketplace yet", unit.id());
            case PUBLISHED -> {
                UnitVersion version = record.version().orElseThrow();
                if (!unit.version().sameLine(version)) {
                    log.info("{}: marketplace has {}, different major/minor than {}; no marketplace floor", unit.id(), version, unit.version());
                } else {
                    log.info("{}: marketplace version {}", unit.id(), version);
                }
            }
            default -> throw new IllegalStateException("Unhandled registry record " + record.kind());
        }
        return record;
    }

    private static List<UnitManifest> inProcessingOrder(List<UnitManifest> units) {
        Set<String> seen = new HashSet<>();
        for (UnitManifest unit : units) {
            if (!seen.add(unit.id())) {
                throw new ManifestException(unit.path(), "Duplicate unit id " + unit.id() + " in " + unit.path());
            }
        }
        List<UnitManifest> ordered = new ArrayList<>(units);
        ordered.sort(Comparator.comparing(UnitManifest::id));
        return ordered;
    }
}
