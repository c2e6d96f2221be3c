package work.lcod.versioner.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.versioner.api.LogLevel;
import work.lcod.versioner.api.VersionerRunner;
import work.lcod.versioner.api.VersionerSettings;
import work.lcod.versioner.reconcile.ReconcileException;
import work.lcod.versioner.shared.DurationParser;
import work.lcod.versioner.summary.RunSummary;

@CommandLine.Command(
    name = "update",
    description = "Bump the patch version of every changed extension manifest.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class UpdateCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging = new LoggingOptions();

    @CommandLine.Option(names = "--root", description = "Repository root holding the manifests.", defaultValue = ".")
    private Path root;

    @CommandLine.Option(
        names = "--manifest-glob",
        description = "File name pattern of extension manifests in the repository root.",
        defaultValue = VersionerSettings.DEFAULT_MANIFEST_GLOB
    )
    private String manifestGlob;

    @CommandLine.Option(
        names = "--units-root",
        description = "Directory whose sub-directories are the extension sources.",
        defaultValue = VersionerSettings.DEFAULT_UNITS_ROOT
    )
    private String unitsRoot;

    @CommandLine.Option(
        names = "--counter-file",
        description = "Global counter file, relative to the repository root.",
        defaultValue = VersionerSettings.DEFAULT_COUNTER_FILE
    )
    private Path counterFile;

    @CommandLine.Option(
        names = "--summary-file",
        description = "Also write the run summary as JSON to this file (relative to the repository root).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path summaryFile;

    @CommandLine.Option(
        names = "--publisher",
        description = "Marketplace publisher id (default: $PUBLISHER_ID); enables the marketplace floor.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String publisher;

    @CommandLine.Option(
        names = "--force",
        description = "Bump every extension regardless of changes (default: $FORCE_UPDATE)."
    )
    private boolean force;

    @CommandLine.Option(
        names = "--registry-timeout",
        description = "Timeout of a single marketplace query (e.g. 30s, 2m).",
        defaultValue = "60s"
    )
    private String registryTimeoutRaw;

    private final Map<String, String> environment;
    private final VersionerRunner runner;

    UpdateCommand() {
        this(System.getenv(), new VersionerRunner());
    }

    UpdateCommand(Map<String, String> environment, VersionerRunner runner) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = logging.apply(environment);
        Duration registryTimeout = DurationParser.parse(registryTimeoutRaw)
            .orElse(VersionerSettings.DEFAULT_REGISTRY_TIMEOUT);

        VersionerSettings settings = VersionerSettings.builder()
            .repositoryRoot(Paths.get("").toAbsolutePath().resolve(root))
            .manifestGlob(manifestGlob)
            .unitsRoot(unitsRoot)
            .counterFile(counterFile)
            .summaryFile(Optional.ofNullable(summaryFile))
            .publisherId(Optional.ofNullable(publisher))
            .forceUpdate(force)
            .registryTimeout(registryTimeout)
            .logLevel(logLevel)
            .environment(environment)
            .build();

        PrintWriter out = spec.commandLine().getOut();
        try {
            RunSummary summary = runner.run(settings);
            print(out, summary);
            return 0;
        } catch (ReconcileException ex) {
            print(out, ex.partialResult().summary());
            throw ex;
        }
    }

    private static void print(PrintWriter out, RunSummary summary) {
        out.println();
        summary.toLines().forEach(out::println);
        out.flush();
    }
}
