package work.lcod.versioner.api;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.versioner.counter.CounterState;
import work.lcod.versioner.counter.CounterStore;
import work.lcod.versioner.manifest.ManifestAccessor;
import work.lcod.versioner.manifest.UnitManifest;
import work.lcod.versioner.reconcile.ReconcileException;
import work.lcod.versioner.reconcile.ReconcileResult;
import work.lcod.versioner.reconcile.VersionReconciler;
import work.lcod.versioner.registry.TfxRegistryClient;
import work.lcod.versioner.shared.AtomicFiles;
import work.lcod.versioner.shared.CommandRunner;
import work.lcod.versioner.shared.ProcessCommandRunner;
import work.lcod.versioner.summary.RunSummary;
import work.lcod.versioner.vcs.GitChangeDetector;

/**
 * Public entry point for one versioning run: discovers and validates every manifest, reads the
 * counter, reconciles, then writes the counter exactly once.
 */
public final class VersionerRunner {
    private static final Logger log = LoggerFactory.getLogger(VersionerRunner.class);

    private final CommandRunner commands;
    private final Clock clock;

    public VersionerRunner() {
        this(new ProcessCommandRunner(), Clock.systemUTC());
    }

    public VersionerRunner(CommandRunner commands, Clock clock) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RunSummary run(VersionerSettings settings) {
        var accessor = new ManifestAccessor(settings.repositoryRoot(), settings.unitsRoot());
        var units = loadAll(accessor, settings);
        var counterStore = new CounterStore(settings.counterFile());
        CounterState initial = counterStore.read();
        log.info("Global counter starts at {}", initial.value());

        var reconciler = new VersionReconciler(
            accessor,
            new GitChangeDetector(commands, settings.repositoryRoot()),
            new TfxRegistryClient(commands, settings.repositoryRoot(), settings.registryTimeout()),
            clock
        );

        ReconcileResult result;
        try {
            result = reconciler.reconcile(units, initial, settings.forceUpdate(), settings.publisherId());
        } catch (ReconcileException ex) {
            try {
                persist(counterStore, initial, ex.partialResult(), settings);
            } catch (RuntimeException persistFailure) {
                ex.addSuppressed(persistFailure);
            }
            throw ex;
        }
        persist(counterStore, initial, result, settings);
        return result.summary();
    }

    private List<UnitManifest> loadAll(ManifestAccessor accessor, VersionerSettings settings) {
        List<Path> paths = accessor.discover(settings.manifestGlob());
        log.info("Found {} extension manifest(s) to update:", paths.size());
        paths.forEach(path -> log.info("  - {}", path.getFileName()));
        List<UnitManifest> units = new ArrayList<>(paths.size());
        for (Path path : paths) {
            units.add(accessor.load(path));
        }
        return units;
    }

    private void persist(CounterStore store, CounterState initial, ReconcileResult result, VersionerSettings settings) {
        if (!result.counter().equals(initial)) {
            try {
                store.write(result.counter());
                log.info("Global counter advanced to {}", result.counter().value());
            } catch (IOException ex) {
                throw new IllegalStateException(
                    "Manifests were updated but counter file " + store.file() + " could not be written (value "
                        + result.counter().value() + "): " + ex.getMessage(),
                    ex
                );
            }
        }
        if (settings.summaryFile().isPresent()) {
            Path target = settings.summaryFile().get();
            try {
                AtomicFiles.writeString(target, result.summary().toPrettyJson() + "\n");
            } catch (IOException ex) {
                throw new IllegalStateException("Unable to write run summary to " + target + ": " + ex.getMessage(), ex);
            }
        }
    }
}
