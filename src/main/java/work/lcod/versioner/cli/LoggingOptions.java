package work.lcod.versioner.cli;

import ch.qos.logback.classic.Logger;
import java.util.Map;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.versioner.api.LogLevel;
import work.lcod.versioner.api.VersionerSettings;

/**
 * {@code --log-level} shared by every subcommand; falls back to {@code VERSIONER_LOG_LEVEL}.
 */
final class LoggingOptions {
    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal); default info or $VERSIONER_LOG_LEVEL.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    LogLevel apply(Map<String, String> env) {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = env.get(VersionerSettings.LOG_LEVEL_ENV);
        }
        LogLevel level = LogLevel.from(candidate);
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger logbackRoot) {
            logbackRoot.setLevel(level.logbackLevel());
        }
        return level;
    }
}
