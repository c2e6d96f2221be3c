package work.lcod.versioner.vcs;

import java.util.Objects;
import java.util.Optional;

/**
 * Per-unit change detection result; {@code headRevision} becomes the next {@code lastVersionCommit}.
 */
public record ChangeRecord(boolean hasChanges, Optional<String> headRevision) {
    public ChangeRecord {
        Objects.requireNonNull(headRevision, "headRevision");
    }
}
