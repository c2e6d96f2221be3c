package work.lcod.versioner.api;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.versioner.manifest.ManifestAccessor;
import work.lcod.versioner.manifest.UnitManifest;
import work.lcod.versioner.registry.RegistryClient;
import work.lcod.versioner.registry.RegistryVersionRecord;

/**
 * Decides whether a single manifest needs publishing by comparing it with the marketplace.
 */
public final class PublishCheck {
    private static final Logger log = LoggerFactory.getLogger(PublishCheck.class);

    private final ManifestAccessor manifests;
    private final RegistryClient registry;

    public PublishCheck(ManifestAccessor manifests, RegistryClient registry) {
        this.manifests = Objects.requireNonNull(manifests, "manifests");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public PublishCheckResult check(Path manifestPath, Optional<String> publisherId) {
        UnitManifest unit = manifests.loadDescriptor(manifestPath);
        String name = unit.name().orElse(unit.id());
        log.info("Checking {} ({}), local version {}", name, unit.id(), unit.version());

        if (publisherId.isEmpty()) {
            log.warn("No publisher ID provided, cannot check marketplace version");
            return PublishCheckResult.publish(unit, name, null, "No publisher ID provided");
        }

        RegistryVersionRecord record = registry.lookup(publisherId.get(), unit.id());
        if (record.isUnknown()) {
            log.warn("Marketplace version unknown ({}); publishing lets the marketplace decide", record.detail());
            return PublishCheckResult.publish(unit, name, null, "Marketplace version unknown: " + record.detail());
        }
        if (!record.isPublished()) {
            log.info("Marketplace version: not published yet");
            return PublishCheckResult.publish(unit, name, null, "Not yet published");
        }

        var marketplace = record.version().orElseThrow();
        log.info("Marketplace version: {}", marketplace);
        int comparison = unit.version().compareTo(marketplace);
        if (comparison > 0) {
            return PublishCheckResult.publish(unit, name, marketplace, "Local version is newer");
        }
        if (comparison == 0) {
            return PublishCheckResult.skip(unit, name, marketplace, "Versions are equal", false);
        }
        log.warn("Local version {} is older than marketplace {}; versions must never go backwards", unit.version(), marketplace);
        return PublishCheckResult.skip(unit, name, marketplace, "Local version is older (downgrade not allowed)", true);
    }
}
