package work.contracts.renderer.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.contracts.renderer.api.ContractRenderer;
import work.contracts.renderer.api.LogLevel;
import work.contracts.renderer.api.RenderConfiguration;
import work.contracts.renderer.api.RenderException;
import work.contracts.renderer.api.RenderResult;
import work.contracts.renderer.config.ConfigurationLoader;

@CommandLine.Command(
    name = "contract-render",
    description = "Link a contract template and the feature modules it imports into a single file.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class RenderCommand implements Callable<Integer> {
    static final String LOG_LEVEL_ENV = "RENDERER_LOG_LEVEL";
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-i", "--in"},
        required = true,
        paramLabel = "TEMPLATE",
        description = "Template module to render."
    )
    private Path input;

    @CommandLine.Option(
        names = {"-o", "--out"},
        paramLabel = "FILE",
        description = "Rendered output file (default: <template-dir>/<template>_rendered.py).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = {"-s", "--source-root"},
        paramLabel = "DIR",
        description = "Directory searched for feature modules; repeatable (default: the template's directory)."
    )
    private List<Path> sourceRoots = new ArrayList<>();

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "FILE",
        description = "TOML, YAML or JSON file overriding the bundled renderer defaults.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = "--use-git",
        description = "Add the last commit touching each module to its header; modules must be committed."
    )
    private boolean useGit;

    @CommandLine.Option(
        names = "--git-repo-root",
        paramLabel = "DIR",
        description = "Where to start looking for the git repository (default: the template's directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path gitRepoRoot;

    @CommandLine.Option(
        names = "--use-full-filepath-in-headers",
        description = "Show module paths relative to the repository (or working directory) instead of file names."
    )
    private boolean useFullFilepathInHeaders;

    @CommandLine.Option(
        names = "--no-apply-formatting",
        description = "Skip the final layout pass."
    )
    private boolean noApplyFormatting;

    @CommandLine.Option(
        names = {"-f", "--force"},
        description = "Overwrite the output file if it already exists."
    )
    private boolean force;

    @CommandLine.Option(
        names = "--json",
        description = "Print a JSON report of the render on stdout."
    )
    private boolean json;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        var started = Instant.now();
        var logLevel = resolveLogLevel();
        System.setProperty(SIMPLE_LOGGER_LEVEL, logLevel.simpleLoggerName());

        if (!Files.isRegularFile(input)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Input file does not exist: " + input);
        }
        var target = output != null ? output : ContractRenderer.defaultOutputPath(input);
        if (Files.isDirectory(target)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Output path is a directory: " + target);
        }
        if (Files.exists(target) && !force) {
            throw new CommandLine.ParameterException(
                spec.commandLine(),
                "Output file " + target + " already exists; pass --force to overwrite it."
            );
        }

        var configuration = buildConfiguration(target, logLevel);
        var renderer = new ContractRenderer();
        RenderResult result;
        try {
            result = renderer.renderToFile(configuration);
        } catch (RenderException ex) {
            if (!json) {
                throw ex;
            }
            result = RenderResult.failure(ex, baseMetadata(), started);
        }
        if (json) {
            spec.commandLine().getOut().println(result.toPrettyJson());
            spec.commandLine().getOut().flush();
        }
        return result.status().exitCode();
    }

    private RenderConfiguration buildConfiguration(Path target, LogLevel logLevel) {
        var builder = RenderConfiguration.builder()
            .templatePath(input)
            .outputPath(target)
            .logLevel(logLevel);
        if (configFile != null) {
            ConfigurationLoader.apply(configFile, builder);
        }
        if (!sourceRoots.isEmpty()) {
            builder.sourceRoots(sourceRoots);
        }
        if (useGit) {
            builder.useGit(true);
        }
        if (gitRepoRoot != null) {
            builder.gitRepoRoot(gitRepoRoot);
        }
        if (useFullFilepathInHeaders) {
            builder.useFullFilepathInHeaders(true);
        }
        if (noApplyFormatting) {
            builder.applyFormatting(false);
        }
        return builder.build();
    }

    private Map<String, Object> baseMetadata() {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("template", input.toString());
        return metadata;
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        return LogLevel.from(candidate);
    }
}
