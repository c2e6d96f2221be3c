package work.lcod.versioner.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.versioner.manifest.UnitVersion;
import work.lcod.versioner.shared.CommandResult;
import work.lcod.versioner.shared.CommandRunner;

/**
 * Queries the Azure DevOps marketplace through {@code tfx extension show --json}.
 *
 * <p>Identifiers are validated before they reach the argument vector, and everything the tool
 * prints is treated as untrusted text.
 */
public final class TfxRegistryClient implements RegistryClient {
    private static final Logger log = LoggerFactory.getLogger(TfxRegistryClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final List<String> NOT_FOUND_MARKERS = List.of("not found", "does not exist");

    private final CommandRunner runner;
    private final Path workingDirectory;
    private final Duration timeout;
    private final String tfxExecutable;

    public TfxRegistryClient(CommandRunner runner, Path workingDirectory, Duration timeout) {
        this(runner, workingDirectory, timeout, "tfx");
    }

    public TfxRegistryClient(CommandRunner runner, Path workingDirectory, Duration timeout, String tfxExecutable) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.tfxExecutable = Objects.requireNonNull(tfxExecutable, "tfxExecutable");
    }

    @Override
    public RegistryVersionRecord lookup(String publisherId, String unitId) {
        if (!RegistryClient.isValidIdentifier(publisherId) || !RegistryClient.isValidIdentifier(unitId)) {
            log.warn("Invalid publisher ID or extension ID format; marketplace not queried for '{}'", unitId);
            return RegistryVersionRecord.unknown("invalid publisher or extension identifier");
        }

        List<String> command = List.of(
            tfxExecutable,
            "extension",
            "show",
            "--publisher",
            publisherId,
            "--extension-id",
            unitId,
            "--json"
        );
        CommandResult result;
        try {
            result = runner.run(workingDirectory, command, timeout);
        } catch (IOException | RuntimeException ex) {
            log.warn("Could not query marketplace for {}.{}: {}", publisherId, unitId, ex.getMessage());
            return RegistryVersionRecord.unknown("marketplace query failed: " + ex.getMessage());
        }

        if (!result.succeeded()) {
            String output = result.combinedOutput().toLowerCase(Locale.ROOT);
            if (NOT_FOUND_MARKERS.stream().anyMatch(output::contains)) {
                return RegistryVersionRecord.notPublished();
            }
            log.warn("Marketplace query for {}.{} exited with code {}", publisherId, unitId, result.exitCode());
            return RegistryVersionRecord.unknown("tfx exited with code " + result.exitCode());
        }
        return parse(publisherId, unitId, result.stdout());
    }

    RegistryVersionRecord parse(String publisherId, String unitId, String output) {
        JsonNode root;
        try {
            root = readJson(output);
        } catch (IOException | IllegalArgumentException ex) {
            log.warn("Unparsable marketplace response for {}.{}: {}", publisherId, unitId, ex.getMessage());
            return RegistryVersionRecord.unknown("unparsable marketplace response");
        }
        if (root == null || !root.isObject()) {
            log.warn("Unexpected marketplace response for {}.{}", publisherId, unitId);
            return RegistryVersionRecord.unknown("unexpected marketplace response");
        }

        JsonNode latest = root.path("versions").path(0).path("version");
        if (!latest.isTextual() || latest.textValue().isBlank()) {
            return RegistryVersionRecord.notPublished();
        }
        UnitVersion published;
        try {
            published = UnitVersion.parse(latest.textValue());
        } catch (IllegalArgumentException ex) {
            log.warn("Marketplace reported unparsable version '{}' for {}.{}", latest.textValue(), publisherId, unitId);
            return RegistryVersionRecord.unknown("unparsable marketplace version " + latest.textValue());
        }
        if (published.patch() == Integer.MAX_VALUE) {
            log.warn("Marketplace reported version {} for {}.{}, no patch can exceed it", published, publisherId, unitId);
            return RegistryVersionRecord.unknown("marketplace patch out of range in " + published);
        }
        return RegistryVersionRecord.published(published);
    }

    /**
     * Parses the output as is; entity-encoded payloads are decoded only when the raw text is not JSON,
     * so escaped text inside valid string values stays untouched.
     */
    private static JsonNode readJson(String output) throws IOException {
        try {
            return JSON.readTree(output);
        } catch (JsonProcessingException raw) {
            String decoded = HtmlEntities.decode(output);
            if (decoded.equals(output)) {
                throw raw;
            }
            return JSON.readTree(decoded);
        }
    }
}
