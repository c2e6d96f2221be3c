package work.lcod.versioner.vcs;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.versioner.shared.CommandResult;
import work.lcod.versioner.shared.CommandRunner;

/**
 * {@link ChangeDetector} that shells out to the {@code git} CLI.
 */
public final class GitChangeDetector implements ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(GitChangeDetector.class);
    private static final Pattern OBJECT_ID = Pattern.compile("^[0-9a-fA-F]{7,64}$");
    private static final Duration GIT_TIMEOUT = Duration.ofMinutes(2);

    private final CommandRunner runner;
    private final Path repositoryRoot;
    private final String gitExecutable;

    public GitChangeDetector(CommandRunner runner, Path repositoryRoot) {
        this(runner, repositoryRoot, "git");
    }

    public GitChangeDetector(CommandRunner runner, Path repositoryRoot, String gitExecutable) {
        this.runner = Objects.requireNonNull(runner, "runner");
        this.repositoryRoot = Objects.requireNonNull(repositoryRoot, "repositoryRoot");
        this.gitExecutable = Objects.requireNonNull(gitExecutable, "gitExecutable");
    }

    @Override
    public boolean hasChanges(Set<String> trackedPaths, String since) {
        if (since == null || since.isBlank()) {
            log.debug("No recorded revision, assuming changes for {}", trackedPaths);
            return true;
        }
        if (!OBJECT_ID.matcher(since.trim()).matches()) {
            log.warn("Recorded revision '{}' is not a git object id; assuming changes", since);
            return true;
        }
        if (trackedPaths.isEmpty()) {
            log.warn("No tracked paths given; assuming changes");
            return true;
        }

        List<String> command = new ArrayList<>(List.of(gitExecutable, "log", "--format=%H", since.trim() + "..HEAD", "--"));
        command.addAll(trackedPaths);
        try {
            CommandResult result = runner.run(repositoryRoot, command, GIT_TIMEOUT);
            if (!result.succeeded()) {
                log.warn(
                    "git log exited with code {} (history rewritten or shallow clone?); assuming changes: {}",
                    result.exitCode(),
                    firstLine(result.stderr())
                );
                return true;
            }
            boolean changed = !result.stdout().isBlank();
            log.debug("Commits touching {} since {}: {}", trackedPaths, since, changed ? "yes" : "none");
            return changed;
        } catch (IOException | RuntimeException ex) {
            log.warn("Could not query git history; assuming changes: {}", ex.getMessage());
            return true;
        }
    }

    @Override
    public Optional<String> headRevision() {
        try {
            CommandResult result = runner.run(repositoryRoot, List.of(gitExecutable, "rev-parse", "HEAD"), GIT_TIMEOUT);
            String head = result.stdout().trim();
            if (result.succeeded() && OBJECT_ID.matcher(head).matches()) {
                return Optional.of(head);
            }
            log.warn("git rev-parse HEAD failed with code {}: {}", result.exitCode(), firstLine(result.stderr()));
        } catch (IOException | RuntimeException ex) {
            log.warn("Could not determine head revision: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private static String firstLine(String text) {
        String trimmed = text.strip();
        int newline = trimmed.indexOf('\n');
        return newline < 0 ? trimmed : trimmed.substring(0, newline);
    }
}
