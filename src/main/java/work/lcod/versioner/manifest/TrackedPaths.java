package work.lcod.versioner.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Derives the repository paths whose commits count towards a unit.
 *
 * <p>Build outputs are ignored by git, so an entry such as {@code apps/notification-hub/dist}
 * is collapsed to its unit source directory {@code apps/notification-hub/}. Entries outside the
 * units root are tracked literally. The manifest itself is always tracked so manifest-only edits
 * count as changes.
 */
public final class TrackedPaths {
    private TrackedPaths() {}

    /**
     * @return ordered, de-duplicated paths; empty when {@code files} declares no usable path
     */
    public static Set<String> derive(JsonNode files, String manifestPath, String unitsRoot) {
        Set<String> fromFiles = new LinkedHashSet<>();
        if (files != null && files.isArray()) {
            for (JsonNode file : files) {
                if (!file.isObject() || !file.path("path").isTextual()) {
                    continue;
                }
                if (file.path("addressable").isBoolean() && !file.path("addressable").booleanValue()) {
                    continue;
                }
                String normalized = normalize(file.path("path").textValue());
                if (!normalized.isEmpty()) {
                    fromFiles.add(collapse(normalized, normalize(unitsRoot)));
                }
            }
        }
        if (fromFiles.isEmpty()) {
            return Set.of();
        }
        Set<String> tracked = new LinkedHashSet<>();
        tracked.add(normalize(manifestPath));
        tracked.addAll(fromFiles);
        return Collections.unmodifiableSet(tracked);
    }

    static String normalize(String raw) {
        String value = raw.trim().replace('\\', '/');
        while (value.startsWith("./")) {
            value = value.substring(2);
        }
        while (value.length() > 1 && value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return ".".equals(value) ? "" : value;
    }

    private static String collapse(String path, String unitsRoot) {
        if (unitsRoot.isEmpty()) {
            return path;
        }
        String prefix = unitsRoot + "/";
        if (!path.startsWith(prefix)) {
            return path;
        }
        String rest = path.substring(prefix.length());
        int slash = rest.indexOf('/');
        String unitDirectory = slash < 0 ? rest : rest.substring(0, slash);
        if (unitDirectory.isEmpty()) {
            return path;
        }
        return prefix + unitDirectory + "/";
    }
}
