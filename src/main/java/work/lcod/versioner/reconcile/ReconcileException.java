package work.lcod.versioner.reconcile;

/**
 * Fail-stop abort of a run. {@link #partialResult()} carries the units processed so far and the
 * counter matching what was actually written to disk, which the caller still persists.
 */
public class ReconcileException extends RuntimeException {
    private final transient ReconcileResult partialResult;

    public ReconcileException(String message, ReconcileResult partialResult, Throwable cause) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public ReconcileResult partialResult() {
        return partialResult;
    }
}
