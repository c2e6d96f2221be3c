package work.lcod.versioner.shared;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external program from an argument vector. Implementations must never hand the
 * arguments to a shell.
 */
public interface CommandRunner {
    CommandResult run(Path workingDirectory, List<String> command, Duration timeout) throws IOException;
}
