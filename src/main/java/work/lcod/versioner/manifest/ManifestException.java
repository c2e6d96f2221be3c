package work.lcod.versioner.manifest;

import java.nio.file.Path;

/**
 * A manifest could not be read, validated or written. Always fatal for the whole run.
 */
public class ManifestException extends RuntimeException {
    private final Path manifestPath;

    public ManifestException(Path manifestPath, String message) {
        super(message);
        this.manifestPath = manifestPath;
    }

    public ManifestException(Path manifestPath, String message, Throwable cause) {
        super(message, cause);
        this.manifestPath = manifestPath;
    }

    public Path manifestPath() {
        return manifestPath;
    }
}
