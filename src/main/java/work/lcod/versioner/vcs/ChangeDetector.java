package work.lcod.versioner.vcs;

import java.util.Optional;
import java.util.Set;

/**
 * Answers whether committed history touched a set of paths since a recorded revision.
 *
 * <p>Implementations fail open: when history cannot be queried, {@link #hasChanges} returns
 * {@code true} instead of throwing, so a version bump is never skipped because of tooling.
 */
public interface ChangeDetector {
    /**
     * @param trackedPaths repository-relative paths to restrict the history to
     * @param since revision recorded at the last update, or {@code null} when unknown
     */
    boolean hasChanges(Set<String> trackedPaths, String since);

    /**
     * Current head revision, empty when it cannot be determined.
     */
    Optional<String> headRevision();

    default ChangeRecord detect(Set<String> trackedPaths, String since) {
        return new ChangeRecord(hasChanges(trackedPaths, since), headRevision());
    }
}
