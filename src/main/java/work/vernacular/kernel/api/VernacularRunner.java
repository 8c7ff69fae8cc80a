package work.vernacular.kernel.api;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.vernacular.kernel.core.BuiltinCommandExecutor;
import work.vernacular.kernel.flow.FlowErrorUtils;
import work.vernacular.kernel.parse.Program;
import work.vernacular.kernel.parse.ScriptParser;
import work.vernacular.kernel.runtime.CommandExecutor;
import work.vernacular.kernel.runtime.Environment;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.shared.KernelLog;

/**
 * Public entry point for embedding the engine: load, parse, execute, report. Never throws for script problems;
 * failures come back as {@link RunResult.Status#FAILURE} with a normalized {@code error} entry.
 */
public final class VernacularRunner {
    private final CommandExecutor executor;

    public VernacularRunner() {
        this(BuiltinCommandExecutor.create());
    }

    public VernacularRunner(CommandExecutor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var log = KernelLog.stderr(configuration.logLevel());
        var buffer = new ByteArrayOutputStream();
        var out = configuration.captureOutput()
            ? new PrintStream(buffer, true, StandardCharsets.UTF_8)
            : configuration.output();
        var env = new Environment(configuration.settings(), configuration.workingDirectory(), out, log);
        var engine = new ExecutionEngine(env, executor);
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("script", configuration.scriptTarget().display());
        Program program = null;
        try {
            var source = ScriptLoader.load(configuration.scriptTarget(), configuration.settings().httpTimeout());
            program = new ScriptParser(configuration.settings().tokenizer()).parse(source);
            log.debug("parsed %s: %d top-level items, %d lines", configuration.scriptTarget().display(),
                program.items().size(), program.lineCount());
            engine.run(program);
            metadata.put("status", "ok");
            describe(metadata, engine, env, program, configuration, buffer);
            return RunResult.success(metadata, started);
        } catch (RuntimeException ex) {
            var error = FlowErrorUtils.normalize(ex);
            log.error("%s", ex.getMessage());
            if (Boolean.getBoolean("vernacular.debug")) {
                ex.printStackTrace();
            }
            metadata.put("status", "error");
            metadata.put("error", error);
            describe(metadata, engine, env, program, configuration, buffer);
            return RunResult.failure(error, metadata, started);
        } finally {
            out.flush();
        }
    }

    private static void describe(
        Map<String, Object> metadata,
        ExecutionEngine engine,
        Environment env,
        Program program,
        RunConfiguration configuration,
        ByteArrayOutputStream buffer
    ) {
        var stats = engine.stats();
        metadata.put("commandsExecuted", stats.commandsExecuted());
        metadata.put("commandsSucceeded", stats.commandsSucceeded());
        metadata.put("commandsFailed", stats.commandsFailed());
        metadata.put("topLevelItems", program == null ? 0 : program.items().size());
        metadata.put("functions", env.functionNames());
        metadata.put("variables", new LinkedHashMap<>(env.scopes().global().bindings()));
        if (configuration.captureOutput()) {
            metadata.put("output", buffer.toString(StandardCharsets.UTF_8));
        }
    }
}
