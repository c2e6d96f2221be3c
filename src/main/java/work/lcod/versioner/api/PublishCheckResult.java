package work.lcod.versioner.api;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.versioner.manifest.UnitManifest;
import work.lcod.versioner.manifest.UnitVersion;

/**
 * Outcome of {@link PublishCheck}; {@code marketplaceVersion} is {@code null} when none is known.
 */
public record PublishCheckResult(
    String extensionId,
    String extensionName,
    UnitVersion localVersion,
    UnitVersion marketplaceVersion,
    boolean needsPublish,
    String reason,
    boolean warning
) {
    public static final int EXIT_PUBLISH = 0;
    public static final int EXIT_SKIP = 1;
    public static final int EXIT_ERROR = 2;

    static PublishCheckResult publish(UnitManifest unit, String name, UnitVersion marketplace, String reason) {
        return new PublishCheckResult(unit.id(), name, unit.version(), marketplace, true, reason, false);
    }

    static PublishCheckResult skip(UnitManifest unit, String name, UnitVersion marketplace, String reason, boolean warning) {
        return new PublishCheckResult(unit.id(), name, unit.version(), marketplace, false, reason, warning);
    }

    public int exitCode() {
        return needsPublish ? EXIT_PUBLISH : EXIT_SKIP;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("extensionId", extensionId);
        map.put("extensionName", extensionName);
        map.put("localVersion", localVersion.toString());
        map.put("marketplaceVersion", marketplaceVersion == null ? null : marketplaceVersion.toString());
        map.put("needsPublish", needsPublish);
        map.put("reason", reason);
        if (warning) {
            map.put("warning", true);
        }
        return map;
    }
}
