package work.vernacular.kernel.cli;

import java.io.PrintWriter;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.vernacular.kernel.api.RunConfiguration;
import work.vernacular.kernel.api.RunResult;
import work.vernacular.kernel.api.ScriptTarget;
import work.vernacular.kernel.api.SettingsLoader;
import work.vernacular.kernel.api.VernacularRunner;
import work.vernacular.kernel.runtime.EngineSettings;
import work.vernacular.kernel.shared.LogLevel;

@CommandLine.Command(
    name = "vernacular-run",
    description = "Run an indentation-structured natural-language script.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class VernacularRunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "SCRIPT",
        description = "Script file path or HTTP(S) URL."
    )
    private String script;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "TOML settings file ([engine] and [http] tables).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--max-while-iterations",
        description = "Safety limit for while loops (overrides the settings file).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxWhileIterations;

    @CommandLine.Option(
        names = "--log-level",
        description = "Kernel log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print the run result as JSON after the script output."
    )
    private boolean json;

    @CommandLine.Option(
        names = {"-w", "--workdir"},
        description = "Directory file commands resolve against (default: the script's directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path workdir;

    @Override
    public Integer call() {
        var target = detectScriptTarget(script);
        var settings = config == null ? EngineSettings.defaults() : SettingsLoader.load(config);
        if (maxWhileIterations != null) {
            if (maxWhileIterations < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--max-while-iterations must be positive");
            }
            settings = settings.withMaxWhileIterations(maxWhileIterations);
        }

        var configuration = RunConfiguration.builder()
            .scriptTarget(target)
            .workingDirectory(determineWorkingDirectory(target))
            .settings(settings)
            .logLevel(resolveLogLevel())
            .emitJson(json)
            .build();

        RunResult result = new VernacularRunner().run(configuration);
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (configuration.emitJson()) {
            out.println(result.toPrettyJson());
            out.flush();
        } else if (!result.isSuccess()) {
            err.println(spec.commandLine().getColorScheme().errorText(describeError(result)));
        }
        err.flush();
        return result.status().exitCode();
    }

    private ScriptTarget detectScriptTarget(String value) {
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return ScriptTarget.forRemote(URI.create(value));
        }
        Path path = Paths.get(value).toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Script file not found: " + path);
        }
        return ScriptTarget.forLocal(path);
    }

    private Path determineWorkingDirectory(ScriptTarget target) {
        if (workdir != null) {
            return workdir.toAbsolutePath().normalize();
        }
        return target.localPath()
            .map(Path::getParent)
            .orElseGet(() -> Paths.get("").toAbsolutePath());
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("VERNACULAR_LOG_LEVEL");
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private static String describeError(RunResult result) {
        var error = result.metadata().get("error");
        if (error instanceof Map<?, ?> map) {
            var line = map.get("line");
            var prefix = line == null ? "" : "line " + line + ": ";
            return map.get("code") + ": " + prefix + map.get("message");
        }
        return String.valueOf(error);
    }
}
