package work.lcod.config.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.config.api.BuildConfiguration;
import work.lcod.config.api.ConfigRunner;
import work.lcod.config.api.LogLevel;
import work.lcod.config.format.TreeWriter;
import work.lcod.config.include.SourceRef;
import work.lcod.config.node.Node;
import work.lcod.config.script.ProviderRegistry;
import work.lcod.config.shared.Overrides;

@CommandLine.Command(
    name = "lcod-config",
    description = "Merge configuration sources in order and print the evaluated tree.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ConfigBuildCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        paramLabel = "SOURCE",
        arity = "1..*",
        description = "Source file, inline YAML starting with '{', or an override such as model.classes=100."
    )
    private List<String> sources = new ArrayList<>();

    @CommandLine.Option(
        names = {"-I", "--include-dir"},
        paramLabel = "DIR",
        description = "Extra directory searched for !include targets (repeatable)."
    )
    private List<Path> includeDirs = new ArrayList<>();

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format (yaml|json).",
        defaultValue = "yaml"
    )
    private String format;

    @CommandLine.Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Write the result to FILE instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        LogLevel logLevel = LogLevel.from(logLevelRaw);
        logLevel.apply();
        TreeWriter.Format outputFormat = TreeWriter.Format.from(format);

        Path workingDirectory = Path.of("").toAbsolutePath();
        var builder = BuildConfiguration.builder()
            .workingDirectory(workingDirectory)
            .dynamicProvider(ProviderRegistry.withScripts())
            .logLevel(logLevel);
        includeDirs.forEach(dir -> builder.searchPath(dir.toAbsolutePath()));
        int inline = 0;
        for (String source : sources) {
            if (source.trim().startsWith("{")) {
                builder.source(SourceRef.inline(source, "<argument " + (++inline) + ">"));
            } else if (Overrides.isOverride(source)) {
                builder.override(source);
            } else {
                builder.file(workingDirectory.resolve(source));
            }
        }

        Node tree = new ConfigRunner().build(builder.build());
        if (output != null) {
            TreeWriter.write(tree, outputFormat, output);
        } else {
            spec.commandLine().getOut().print(TreeWriter.write(tree, outputFormat));
            spec.commandLine().getOut().flush();
        }
        return 0;
    }
}
