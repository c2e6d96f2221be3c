package work.lcod.versioner.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessCommandRunnerTest {
    @TempDir
    Path workDir;

    @Test
    void capturesExitCodeAndOutput() throws Exception {
        String java = ProcessHandle.current().info().command().orElse("java");
        var result = new ProcessCommandRunner().run(workDir, List.of(java, "-version"), Duration.ofMinutes(1));
        assertEquals(0, result.exitCode());
        assertTrue(result.combinedOutput().contains("version"));
    }

    @Test
    void missingProgramIsAnIoFailure() {
        assertThrows(IOException.class, () -> new ProcessCommandRunner().run(
            workDir,
            List.of("versioner-no-such-program-" + System.nanoTime()),
            Duration.ofSeconds(5)
        ));
    }

    @Test
    void rejectsEmptyCommand() {
        assertThrows(IllegalArgumentException.class, () -> new ProcessCommandRunner().run(workDir, List.of(), Duration.ofSeconds(1)));
    }
}
