package work.lcod.versioner.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses user-friendly durations used by CLI options (e.g. {@code 30s}, {@code 2m}, {@code 1500ms}).
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern DURATION = Pattern.compile("^(\\d+)(ms|s|m|h)?$");

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = DURATION.matcher(trimmed);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid duration: " + raw + " (expected e.g. 1500, 30s, 2m, 1h)");
        }
        long value = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "ms" : matcher.group(2);
        return Optional.of(switch (unit) {
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            default -> Duration.ofMillis(value);
        });
    }
}
