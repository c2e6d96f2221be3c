package work.lcod.versioner.registry;

import java.util.Objects;
import java.util.Optional;
import work.lcod.versioner.manifest.UnitVersion;

/**
 * What the marketplace said about a unit. {@link Kind#UNKNOWN} means the question could not be
 * answered and must never be read as {@link Kind#NOT_PUBLISHED}.
 */
public record RegistryVersionRecord(Kind kind, Optional<UnitVersion> version, String detail) {
    public enum Kind {
        PUBLISHED,
        NOT_PUBLISHED,
        UNKNOWN
    }

    public RegistryVersionRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(detail, "detail");
        if ((kind == Kind.PUBLISHED) != version.isPresent()) {
            throw new IllegalArgumentException("a version is present exactly when the unit is published");
        }
    }

    public static RegistryVersionRecord published(UnitVersion version) {
        return new RegistryVersionRecord(Kind.PUBLISHED, Optional.of(version), "published " + version);
    }

    public static RegistryVersionRecord notPublished() {
        return new RegistryVersionRecord(Kind.NOT_PUBLISHED, Optional.empty(), "not published");
    }

    public static RegistryVersionRecord unknown(String reason) {
        return new RegistryVersionRecord(Kind.UNKNOWN, Optional.empty(), reason);
    }

    public boolean isPublished() {
        return kind == Kind.PUBLISHED;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }
}
