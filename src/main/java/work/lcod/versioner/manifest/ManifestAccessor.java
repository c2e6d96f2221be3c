package work.lcod.versioner.manifest;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.versioner.shared.AtomicFiles;

/**
 * Reads, validates and writes unit manifests below one repository root.
 */
public final class ManifestAccessor {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter MANIFEST_WRITER = JSON.writer(
        new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"))
            .withArrayIndenter(new DefaultIndenter("  ", "\n"))
            .withoutSpacesInObjectEntries()
    );

    private final Path repositoryRoot;
    private final String unitsRoot;

    public ManifestAccessor(Path repositoryRoot, String unitsRoot) {
        this.repositoryRoot = Objects.requireNonNull(repositoryRoot, "repositoryRoot").toAbsolutePath().normalize();
        this.unitsRoot = Objects.requireNonNull(unitsRoot, "unitsRoot");
    }

    /**
     * Lists manifest files directly under the repository root, sorted by file name.
     */
    public List<Path> discover(String glob) {
        List<Path> manifests = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(repositoryRoot, glob)) {
            for (Path candidate : stream) {
                if (Files.isRegularFile(candidate)) {
                    manifests.add(candidate);
                }
            }
        } catch (IOException ex) {
            throw new ManifestException(repositoryRoot, "Unable to list manifests in " + repositoryRoot + ": " + ex.getMessage(), ex);
        }
        if (manifests.isEmpty()) {
            throw new ManifestException(repositoryRoot, "No extension manifest files found (" + glob + ") in " + repositoryRoot);
        }
        manifests.sort(null);
        return manifests;
    }

    public UnitManifest load(Path path) {
        return load(path, true);
    }

    /**
     * Reads a manifest for identification only: {@code id} and {@code version} must be valid,
     * but a manifest without usable {@code files} is accepted with no tracked paths.
     */
    public UnitManifest loadDescriptor(Path path) {
        return load(path, false);
    }

    private UnitManifest load(Path path, boolean requireTrackedPaths) {
        Path absolute = path.toAbsolutePath().normalize();
        JsonNode root;
        try {
            root = JSON.readTree(Files.readString(absolute, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ManifestException(absolute, "Unable to read manifest " + absolute + ": " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ManifestException(absolute, "Manifest " + absolute + " must contain a JSON object");
        }
        ObjectNode document = (ObjectNode) root;

        String id = document.path("id").isTextual() ? document.path("id").textValue().trim() : "";
        if (id.isEmpty()) {
            throw new ManifestException(absolute, "Invalid or missing id in " + absolute);
        }
        JsonNode rawVersion = document.path(UnitManifest.VERSION_FIELD);
        if (!rawVersion.isTextual()) {
            throw new ManifestException(absolute, "Invalid or missing version in " + absolute + " (unit " + id + ")");
        }
        UnitVersion version;
        try {
            version = UnitVersion.parse(rawVersion.textValue());
        } catch (IllegalArgumentException ex) {
            throw new ManifestException(absolute, "Unit " + id + ": " + ex.getMessage(), ex);
        }

        JsonNode metadata = document.path(UnitManifest.METADATA_FIELD);
        if (!metadata.isMissingNode() && !metadata.isNull() && !metadata.isObject()) {
            throw new ManifestException(absolute, "Unit " + id + ": metadata must be a JSON object");
        }

        Set<String> tracked = TrackedPaths.derive(document.get("files"), relativeToRoot(absolute), unitsRoot);
        if (tracked.isEmpty() && requireTrackedPaths) {
            throw new ManifestException(
                absolute,
                "Unit " + id + ": no tracked paths derivable from 'files'; cannot tell whether it changed"
            );
        }

        return new UnitManifest(
            absolute,
            id,
            text(document.path("name")),
            version,
            tracked,
            text(metadata.path(UnitManifest.LAST_COMMIT_FIELD)),
            text(metadata.path(UnitManifest.LAST_UPDATE_FIELD)),
            document
        );
    }

    /**
     * Writes the manifest document with two-space indentation, original key order and a trailing newline.
     */
    public void save(Path path, UnitManifest manifest) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            AtomicFiles.writeString(absolute, render(manifest));
        } catch (IOException ex) {
            throw new ManifestException(absolute, "Unable to write manifest for unit " + manifest.id() + ": " + ex.getMessage(), ex);
        }
    }

    static String render(UnitManifest manifest) throws IOException {
        return MANIFEST_WRITER.writeValueAsString(manifest.document()) + "\n";
    }

    private String relativeToRoot(Path manifestPath) {
        Path relative = manifestPath.startsWith(repositoryRoot) ? repositoryRoot.relativize(manifestPath) : manifestPath;
        return relative.toString().replace('\\', '/');
    }

    private static Optional<String> text(JsonNode node) {
        if (node == null || !node.isTextual() || node.textValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.textValue().trim());
    }
}
