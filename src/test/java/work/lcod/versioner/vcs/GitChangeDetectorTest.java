package work.lcod.versioner.vcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.versioner.support.ScriptedCommandRunner;
import work.lcod.versioner.support.VersionerTestSupport;

class GitChangeDetectorTest {
    private static final Set<String> TRACKED = new LinkedHashSet<>(List.of("azure-devops-extension-hub.json", "apps/hub/"));

    @Test
    void unknownBaselineAssumesChangesWithoutQueryingGit() {
        var runner = new ScriptedCommandRunner();
        assertTrue(detector(runner).hasChanges(TRACKED, null));
        assertEquals(0, runner.count("git", "log"));
    }

    @Test
    void reportsCommitsInTrackedPaths() {
        var runner = new ScriptedCommandRunner()
            .on("git", "log", ScriptedCommandRunner.ok(VersionerTestSupport.HEAD + "\n"));

        assertTrue(detector(runner).hasChanges(TRACKED, VersionerTestSupport.OLD_COMMIT));
        assertEquals(
            List.of("git", "log", "--format=%H", VersionerTestSupport.OLD_COMMIT + "..HEAD", "--",
                "azure-devops-extension-hub.json", "apps/hub/"),
            runner.invocations().get(0)
        );
    }

    @Test
    void emptyHistoryMeansUnchanged() {
        var runner = new ScriptedCommandRunner().on("git", "log", ScriptedCommandRunner.ok("\n"));
        assertFalse(detector(runner).hasChanges(TRACKED, VersionerTestSupport.OLD_COMMIT));
    }

    @Test
    void failsOpenWhenGitFails() {
        var rewritten = new ScriptedCommandRunner()
            .on("git", "log", ScriptedCommandRunner.failed(128, "fatal: bad revision 'fedcba..HEAD'"));
        assertTrue(detector(rewritten).hasChanges(TRACKED, VersionerTestSupport.OLD_COMMIT));

        var missingGit = new ScriptedCommandRunner().failing("git", "log", new IOException("git: not found"));
        assertTrue(detector(missingGit).hasChanges(TRACKED, VersionerTestSupport.OLD_COMMIT));
    }

    @Test
    void malformedRecordedRevisionIsNeverPassedToGit() {
        var runner = new ScriptedCommandRunner().on("git", "log", ScriptedCommandRunner.ok(""));
        assertTrue(detector(runner).hasChanges(TRACKED, "--output=/tmp/x"));
        assertEquals(0, runner.count("git", "log"));
    }

    @Test
    void headRevisionFromRevParse() {
        var runner = new ScriptedCommandRunner()
            .on("git", "rev-parse", ScriptedCommandRunner.ok(VersionerTestSupport.HEAD + "\n"));
        assertEquals(Optional.of(VersionerTestSupport.HEAD), detector(runner).headRevision());

        var broken = new ScriptedCommandRunner()
            .on("git", "rev-parse", ScriptedCommandRunner.failed(128, "fatal: not a git repository"));
        assertTrue(detector(broken).headRevision().isEmpty());
    }

    @Test
    void detectCombinesBothQueries() {
        var runner = new ScriptedCommandRunner()
            .on("git", "log", ScriptedCommandRunner.ok(""))
            .on("git", "rev-parse", ScriptedCommandRunner.ok(VersionerTestSupport.HEAD));

        var record = detector(runner).detect(TRACKED, VersionerTestSupport.OLD_COMMIT);
        assertFalse(record.hasChanges());
        assertEquals(Optional.of(VersionerTestSupport.HEAD), record.headRevision());
    }

    private static GitChangeDetector detector(ScriptedCommandRunner runner) {
        return new GitChangeDetector(runner, Path.of("."));
    }
}
