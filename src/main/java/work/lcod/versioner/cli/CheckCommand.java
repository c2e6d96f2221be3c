package work.lcod.versioner.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.versioner.api.PublishCheck;
import work.lcod.versioner.api.PublishCheckResult;
import work.lcod.versioner.api.VersionerSettings;
import work.lcod.versioner.manifest.ManifestAccessor;
import work.lcod.versioner.registry.TfxRegistryClient;
import work.lcod.versioner.shared.CommandRunner;
import work.lcod.versioner.shared.DurationParser;
import work.lcod.versioner.shared.ProcessCommandRunner;

@CommandLine.Command(
    name = "check",
    description = {
        "Compare one manifest with the marketplace.",
        "Exit 0 = publish needed, 1 = skip publish, 2 = error."
    },
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    exitCodeOnExecutionException = PublishCheckResult.EXIT_ERROR,
    exitCodeOnInvalidInput = PublishCheckResult.EXIT_ERROR
)
final class CheckCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging = new LoggingOptions();

    @CommandLine.Option(names = "--manifest", required = true, description = "Manifest file to check.")
    private Path manifest;

    @CommandLine.Option(
        names = "--publisher",
        description = "Marketplace publisher id (default: $PUBLISHER_ID).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String publisher;

    @CommandLine.Option(
        names = "--units-root",
        description = "Directory whose sub-directories are the extension sources.",
        defaultValue = VersionerSettings.DEFAULT_UNITS_ROOT
    )
    private String unitsRoot;

    @CommandLine.Option(
        names = "--registry-timeout",
        description = "Timeout of the marketplace query (e.g. 30s, 2m).",
        defaultValue = "60s"
    )
    private String registryTimeoutRaw;

    private final Map<String, String> environment;
    private final CommandRunner commands;

    CheckCommand() {
        this(System.getenv(), new ProcessCommandRunner());
    }

    CheckCommand(Map<String, String> environment, CommandRunner commands) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.commands = Objects.requireNonNull(commands, "commands");
    }

    @Override
    public Integer call() throws Exception {
        logging.apply(environment);
        Path manifestPath = Paths.get("").toAbsolutePath().resolve(manifest).normalize();
        if (!Files.isRegularFile(manifestPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Manifest file not found: " + manifestPath);
        }
        Duration timeout = DurationParser.parse(registryTimeoutRaw).orElse(VersionerSettings.DEFAULT_REGISTRY_TIMEOUT);
        Path workingDir = Optional.ofNullable(manifestPath.getParent()).orElse(manifestPath);
        Optional<String> publisherId = Optional.ofNullable(publisher)
            .or(() -> Optional.ofNullable(environment.get(VersionerSettings.PUBLISHER_ID_ENV)))
            .map(String::trim)
            .filter(value -> !value.isEmpty());

        var check = new PublishCheck(
            new ManifestAccessor(workingDir, unitsRoot),
            new TfxRegistryClient(commands, workingDir, timeout)
        );
        PublishCheckResult result = check.check(manifestPath, publisherId);

        PrintWriter out = spec.commandLine().getOut();
        out.println(JSON_WRITER.writeValueAsString(result.toSerializableMap()));
        out.flush();
        return result.exitCode();
    }
}
