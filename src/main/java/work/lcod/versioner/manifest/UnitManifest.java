package work.lcod.versioner.manifest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One deployable unit as described by its manifest file.
 *
 * <p>{@code document} is the complete parsed manifest; fields this tool does not own are written
 * back untouched. Instances are never mutated: {@link #withNewVersion} returns a copy.
 */
public record UnitManifest(
    Path path,
    String id,
    Optional<String> name,
    UnitVersion version,
    Set<String> trackedPaths,
    Optional<String> lastVersionCommit,
    Optional<String> lastVersionUpdate,
    ObjectNode document
) {
    static final String VERSION_FIELD = "version";
    static final String METADATA_FIELD = "metadata";
    static final String LAST_COMMIT_FIELD = "lastVersionCommit";
    static final String LAST_UPDATE_FIELD = "lastVersionUpdate";

    public UnitManifest {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(lastVersionCommit, "lastVersionCommit");
        Objects.requireNonNull(lastVersionUpdate, "lastVersionUpdate");
        Objects.requireNonNull(document, "document");
        trackedPaths = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(trackedPaths, "trackedPaths")));
    }

    /**
     * Copy carrying a new version and the bookkeeping of the update. A missing {@code commit}
     * removes the recorded revision so the next run treats the unit as changed.
     */
    public UnitManifest withNewVersion(UnitVersion newVersion, Optional<String> commit, Instant updatedAt) {
        ObjectNode copy = document.deepCopy();
        copy.put(VERSION_FIELD, newVersion.toString());
        ObjectNode metadata = copy.path(METADATA_FIELD).isObject()
            ? (ObjectNode) copy.get(METADATA_FIELD)
            : copy.putObject(METADATA_FIELD);
        if (commit.isPresent()) {
            metadata.put(LAST_COMMIT_FIELD, commit.get());
        } else {
            metadata.remove(LAST_COMMIT_FIELD);
        }
        String timestamp = updatedAt.toString();
        metadata.put(LAST_UPDATE_FIELD, timestamp);
        return new UnitManifest(path, id, name, newVersion, trackedPaths, commit, Optional.of(timestamp), copy);
    }
}
