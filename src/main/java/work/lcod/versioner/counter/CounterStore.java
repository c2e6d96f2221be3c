package work.lcod.versioner.counter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.versioner.shared.AtomicFiles;

/**
 * Plain-text file holding the global counter: one integer and a trailing newline.
 */
public final class CounterStore {
    private static final Logger log = LoggerFactory.getLogger(CounterStore.class);

    private static final Pattern POSITIVE_INTEGER = Pattern.compile("^0*([1-9]\\d*)$");

    private final Path file;

    public CounterStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the stored counter, falling back to {@link CounterState#INITIAL} when the file is
     * absent or holds anything but a positive integer.
     */
    public CounterState read() {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException ex) {
            log.warn("Counter file {} not found; starting at {}", file, CounterState.INITIAL.value());
            return CounterState.INITIAL;
        } catch (IOException ex) {
            log.warn("Counter file {} unreadable ({}); starting at {}", file, ex.getMessage(), CounterState.INITIAL.value());
            return CounterState.INITIAL;
        }
        Matcher matcher = POSITIVE_INTEGER.matcher(raw);
        if (matcher.matches()) {
            String digits = matcher.group(1);
            if (digits.length() <= 10 && Long.parseLong(digits) <= Integer.MAX_VALUE) {
                return new CounterState(Integer.parseInt(digits));
            }
            log.warn("Counter file {} holds {}, above the largest supported counter {}; starting at {}",
                file, raw, Integer.MAX_VALUE, CounterState.INITIAL.value());
            return CounterState.INITIAL;
        }
        log.warn("Counter file {} holds '{}', not a positive integer; starting at {}", file, raw, CounterState.INITIAL.value());
        return CounterState.INITIAL;
    }

    public void write(CounterState state) throws IOException {
        AtomicFiles.writeString(file, state.value() + "\n");
    }
}
