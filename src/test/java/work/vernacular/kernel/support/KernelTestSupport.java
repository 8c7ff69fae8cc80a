package work.vernacular.kernel.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import work.vernacular.kernel.core.BuiltinCommandExecutor;
import work.vernacular.kernel.parse.Program;
import work.vernacular.kernel.parse.ScriptParser;
import work.vernacular.kernel.runtime.CommandExecutor;
import work.vernacular.kernel.runtime.EngineSettings;
import work.vernacular.kernel.runtime.Environment;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.shared.KernelLog;
import work.vernacular.kernel.shared.LogLevel;

/**
 * Shared helpers for kernel test suites: an environment whose script output is captured in memory, wired to the
 * built-in command executor unless a test supplies its own.
 */
public final class KernelTestSupport {
    public static final Path SCRIPTS = Path.of("src", "test", "resources", "scripts");

    private KernelTestSupport() {}

    public static Harness harness() {
        return harness(EngineSettings.defaults(), null, BuiltinCommandExecutor.create());
    }

    public static Harness harness(EngineSettings settings) {
        return harness(settings, null, BuiltinCommandExecutor.create());
    }

    public static Harness harness(Path workingDirectory) {
        return harness(EngineSettings.defaults(), workingDirectory, BuiltinCommandExecutor.create());
    }

    public static Harness harness(EngineSettings settings, Path workingDirectory, CommandExecutor executor) {
        return new Harness(settings, workingDirectory, executor);
    }

    public static Program parse(String source) {
        return new ScriptParser().parse(source);
    }

    public static String script(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    public static String fixture(String name) {
        try {
            return Files.readString(SCRIPTS.resolve(name), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static final class Harness {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Environment environment;
        private final ExecutionEngine engine;
        private final EngineSettings settings;

        private Harness(EngineSettings settings, Path workingDirectory, CommandExecutor executor) {
            this.settings = settings;
            var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
            this.environment = new Environment(settings, workingDirectory, out, KernelLog.stderr(LogLevel.FATAL));
            this.engine = new ExecutionEngine(environment, executor);
        }

        public Harness run(String source) {
            engine.run(new ScriptParser(settings.tokenizer()).parse(source));
            return this;
        }

        public Environment environment() {
            return environment;
        }

        public ExecutionEngine engine() {
            return engine;
        }

        public Object variable(String name) {
            return environment.scopes().resolve(name);
        }

        public boolean isDefined(String name) {
            return environment.scopes().isDefined(name);
        }

        public String output() {
            return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
        }

        public List<String> lines() {
            var text = output();
            if (text.isEmpty()) {
                return List.of();
            }
            return List.of(text.split("\n"));
        }
    }
}
