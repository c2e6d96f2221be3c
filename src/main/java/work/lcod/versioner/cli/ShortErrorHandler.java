package work.lcod.versioner.cli;

import picocli.CommandLine;

/**
 * Prints fatal errors as a single line naming the unit and the broken invariant.
 * Stack traces only with {@code -Dversioner.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + message));
        for (Throwable suppressed : ex.getSuppressed()) {
            commandLine.getErr().println(commandLine.getColorScheme().errorText("  also: " + suppressed.getMessage()));
        }
        if (Boolean.getBoolean("versioner.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
