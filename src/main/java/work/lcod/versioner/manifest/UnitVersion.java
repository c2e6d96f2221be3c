package work.lcod.versioner.manifest;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * Flat {@code MAJOR.MINOR.PATCH} version. Major and minor belong to the operator, patch to the reconciler.
 */
public record UnitVersion(int major, int minor, int patch) implements Comparable<UnitVersion> {
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Comparator<UnitVersion> ORDER = Comparator
        .comparingInt(UnitVersion::major)
        .thenComparingInt(UnitVersion::minor)
        .thenComparingInt(UnitVersion::patch);

    public UnitVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("version components must be non-negative");
        }
    }

    /**
     * Parses {@code MAJOR.MINOR} or {@code MAJOR.MINOR.PATCH}; a missing patch reads as 0.
     */
    public static UnitVersion parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("version is missing");
        }
        String[] parts = raw.trim().split("\\.", -1);
        if (parts.length < 2) {
            throw new IllegalArgumentException(
                "Invalid version format: " + raw + ". Expected MAJOR.MINOR format (PATCH is generated automatically)."
            );
        }
        if (parts.length > 3) {
            throw new IllegalArgumentException("Invalid version format: " + raw + ". Expected at most MAJOR.MINOR.PATCH.");
        }
        int major = component(raw, "major", parts[0]);
        int minor = component(raw, "minor", parts[1]);
        int patch = parts.length == 3 ? component(raw, "patch", parts[2]) : 0;
        return new UnitVersion(major, minor, patch);
    }

    private static int component(String raw, String name, String value) {
        if (!NUMBER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid version numbers in: " + raw + ". " + name + " must be an integer.");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid version numbers in: " + raw + ". " + name + " is out of range.");
        }
    }

    public UnitVersion withPatch(int newPatch) {
        return new UnitVersion(major, minor, newPatch);
    }

    public boolean sameLine(UnitVersion other) {
        return other != null && major == other.major && minor == other.minor;
    }

    @Override
    public int compareTo(UnitVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
