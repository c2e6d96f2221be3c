package work.lcod.versioner.reconcile;

/**
 * Per-unit lifecycle within one run. Every state except {@link #PENDING} is terminal.
 */
public enum UnitState {
    PENDING,
    SKIPPED,
    UPDATED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
