package work.lcod.versioner.reconcile;

import java.util.Objects;
import work.lcod.versioner.counter.CounterState;
import work.lcod.versioner.summary.RunSummary;

/**
 * Outcome of one reconciliation pass together with the counter the caller has to persist.
 */
public record ReconcileResult(RunSummary summary, CounterState counter) {
    public ReconcileResult {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(counter, "counter");
    }
}
