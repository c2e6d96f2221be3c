package work.lcod.versioner.shared;

/**
 * Captured outcome of an external command.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {
    public CommandResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    /**
     * Both streams joined, for matching diagnostics that tools print on either side.
     */
    public String combinedOutput() {
        if (stderr.isEmpty()) {
            return stdout;
        }
        if (stdout.isEmpty()) {
            return stderr;
        }
        return stdout + "\n" + stderr;
    }
}
