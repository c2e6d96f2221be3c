package work.lcod.versioner.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "extension-versioner",
    description = "Keep extension versions monotonic across the repository and the marketplace.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { UpdateCommand.class, CheckCommand.class }
)
final class VersionerCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: use 'update' or 'check'.");
    }
}
