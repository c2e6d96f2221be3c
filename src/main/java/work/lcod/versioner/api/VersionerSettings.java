package work.lcod.versioner.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable configuration of one reconciliation run.
 */
public record VersionerSettings(
    Path repositoryRoot,
    String manifestGlob,
    String unitsRoot,
    Path counterFile,
    Optional<Path> summaryFile,
    Optional<String> publisherId,
    boolean forceUpdate,
    Duration registryTimeout,
    LogLevel logLevel
) {
    public static final String PUBLISHER_ID_ENV = "PUBLISHER_ID";
    public static final String FORCE_UPDATE_ENV = "FORCE_UPDATE";
    public static final String LOG_LEVEL_ENV = "VERSIONER_LOG_LEVEL";
    public static final String DEFAULT_MANIFEST_GLOB = "azure-devops-extension-*.json";
    public static final String DEFAULT_UNITS_ROOT = "apps";
    public static final String DEFAULT_COUNTER_FILE = ".version-counter";
    public static final Duration DEFAULT_REGISTRY_TIMEOUT = Duration.ofSeconds(60);

    private static final Pattern TRUE_VALUES = Pattern.compile("true|1|yes");
    private static final Pattern FALSE_VALUES = Pattern.compile("false|0|no");

    public VersionerSettings {
        Objects.requireNonNull(repositoryRoot, "repositoryRoot");
        Objects.requireNonNull(manifestGlob, "manifestGlob");
        Objects.requireNonNull(unitsRoot, "unitsRoot");
        Objects.requireNonNull(counterFile, "counterFile");
        Objects.requireNonNull(summaryFile, "summaryFile");
        Objects.requireNonNull(publisherId, "publisherId");
        Objects.requireNonNull(registryTimeout, "registryTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        publisherId = publisherId.map(String::trim).filter(value -> !value.isEmpty());
        if (registryTimeout.isNegative() || registryTimeout.isZero()) {
            throw new IllegalArgumentException("registry timeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses the boolean flags accepted in environment variables ({@code true|false|1|0|yes|no}).
     * Absent or blank values read as {@code false}; anything else is a configuration error.
     */
    public static boolean parseFlag(String name, String raw) {
        if (raw == null || raw.isBlank()) {
            return false;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.matcher(normalized).matches()) {
            return true;
        }
        if (FALSE_VALUES.matcher(normalized).matches()) {
            return false;
        }
        throw new IllegalArgumentException(name + " must be one of true|false|1|0|yes|no, got: " + raw);
    }

    public static final class Builder {
        private Path repositoryRoot;
        private String manifestGlob = DEFAULT_MANIFEST_GLOB;
        private String unitsRoot = DEFAULT_UNITS_ROOT;
        private Path counterFile;
        private Optional<Path> summaryFile = Optional.empty();
        private Optional<String> publisherId = Optional.empty();
        private boolean forceUpdate;
        private Duration registryTimeout = DEFAULT_REGISTRY_TIMEOUT;
        private LogLevel logLevel = LogLevel.INFO;

        public Builder repositoryRoot(Path repositoryRoot) {
            this.repositoryRoot = repositoryRoot;
            return this;
        }

        public Builder manifestGlob(String manifestGlob) {
            this.manifestGlob = manifestGlob;
            return this;
        }

        public Builder unitsRoot(String unitsRoot) {
            this.unitsRoot = unitsRoot;
            return this;
        }

        public Builder counterFile(Path counterFile) {
            this.counterFile = counterFile;
            return this;
        }

        public Builder summaryFile(Optional<Path> summaryFile) {
            this.summaryFile = summaryFile;
            return this;
        }

        public Builder publisherId(Optional<String> publisherId) {
            this.publisherId = publisherId;
            return this;
        }

        public Builder forceUpdate(boolean forceUpdate) {
            this.forceUpdate = forceUpdate;
            return this;
        }

        public Builder registryTimeout(Duration registryTimeout) {
            this.registryTimeout = registryTimeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        /**
         * Fills publisher and force flag from environment-style inputs, leaving values
         * that were already set explicitly untouched.
         */
        public Builder environment(Map<String, String> env) {
            if (publisherId.isEmpty()) {
                publisherId = Optional.ofNullable(env.get(PUBLISHER_ID_ENV));
            }
            if (!forceUpdate) {
                forceUpdate = parseFlag(FORCE_UPDATE_ENV, env.get(FORCE_UPDATE_ENV));
            }
            return this;
        }

        public VersionerSettings build() {
            Path root = Objects.requireNonNull(repositoryRoot, "repositoryRoot").toAbsolutePath().normalize();
            Path counter = counterFile != null ? root.resolve(counterFile).normalize() : root.resolve(DEFAULT_COUNTER_FILE);
            return new VersionerSettings(
                root,
                manifestGlob,
                unitsRoot,
                counter,
                summaryFile.map(path -> root.resolve(path).normalize()),
                publisherId,
                forceUpdate,
                registryTimeout,
                logLevel
            );
        }
    }
}
