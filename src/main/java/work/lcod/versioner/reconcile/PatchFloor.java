package work.lcod.versioner.reconcile;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import work.lcod.versioner.counter.CounterState;
import work.lcod.versioner.manifest.UnitVersion;
import work.lcod.versioner.registry.RegistryVersionRecord;

/**
 * Computes the next patch of an updated unit from already-resolved inputs. No I/O.
 *
 * <p>Each {@link Signal} contributes an optional lower bound; the result is the largest bound.
 * Signals are listed in dominance order, so on a tie the earlier signal is reported.
 */
public final class PatchFloor {
    /**
     * Lower bounds the next patch must reach.
     */
    public enum Signal {
        /** Shared counter: unique across units and runs. */
        COUNTER {
            @Override
            OptionalInt floor(UnitVersion local, CounterState counter, Optional<RegistryVersionRecord> registry) {
                return OptionalInt.of(counter.value());
            }
        },
        /** The unit's own previous patch, in case the counter regressed or was reseeded. */
        LOCAL_PATCH {
            @Override
            OptionalInt floor(UnitVersion local, CounterState counter, Optional<RegistryVersionRecord> registry) {
                return OptionalInt.of(Math.addExact(local.patch(), 1));
            }
        },
        /** Published marketplace patch, comparable only on the same major.minor line. */
        REGISTRY {
            @Override
            OptionalInt floor(UnitVersion local, CounterState counter, Optional<RegistryVersionRecord> registry) {
                return registry
                    .filter(RegistryVersionRecord::isPublished)
                    .flatMap(RegistryVersionRecord::version)
                    .filter(local::sameLine)
                    .map(published -> OptionalInt.of(Math.addExact(published.patch(), 1)))
                    .orElse(OptionalInt.empty());
            }
        };

        abstract OptionalInt floor(UnitVersion local, CounterState counter, Optional<RegistryVersionRecord> registry);
    }

    private static final List<Signal> DOMINANCE = List.of(Signal.COUNTER, Signal.LOCAL_PATCH, Signal.REGISTRY);

    private PatchFloor() {}

    public static Decision decide(UnitVersion local, CounterState counter, Optional<RegistryVersionRecord> registry) {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(counter, "counter");
        Objects.requireNonNull(registry, "registry");

        int patch = -1;
        Signal dominant = null;
        int localFloor = -1;
        for (Signal signal : DOMINANCE) {
            OptionalInt bound = signal.floor(local, counter, registry);
            if (bound.isPresent() && bound.getAsInt() > patch) {
                patch = bound.getAsInt();
                dominant = signal;
            }
            if (signal != Signal.REGISTRY) {
                localFloor = patch;
            }
        }
        return new Decision(patch, localFloor, dominant);
    }

    /**
     * @param patch the patch to assign
     * @param localFloor the bound from counter and local patch alone
     * @param dominant the signal that set {@code patch}
     */
    public record Decision(int patch, int localFloor, Signal dominant) {
        public boolean raisedByRegistry() {
            return dominant == Signal.REGISTRY;
        }
    }
}
