package work.lcod.versioner.counter;

/**
 * Value of the global patch counter. Always positive; advancing never moves it backwards.
 */
public record CounterState(int value) {
    public static final CounterState INITIAL = new CounterState(1);

    public CounterState {
        if (value < 1) {
            throw new IllegalArgumentException("counter must be positive, got " + value);
        }
    }

    /**
     * Counter after a unit received {@code assignedPatch}: the next unit must get a larger patch.
     */
    public CounterState advancePast(int assignedPatch) {
        return new CounterState(Math.max(value, Math.addExact(assignedPatch, 1)));
    }
}
