package work.vernacular.kernel.api;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;
import work.vernacular.kernel.runtime.EngineSettings;
import work.vernacular.kernel.shared.LogLevel;

/**
 * Immutable configuration passed to {@link VernacularRunner}.
 */
public record RunConfiguration(
    ScriptTarget scriptTarget,
    Path workingDirectory,
    EngineSettings settings,
    LogLevel logLevel,
    PrintStream output,
    boolean captureOutput,
    boolean emitJson
) {
    public RunConfiguration {
        Objects.requireNonNull(scriptTarget, "scriptTarget");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(output, "output");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ScriptTarget scriptTarget;
        private Path workingDirectory = Path.of("").toAbsolutePath();
        private EngineSettings settings = EngineSettings.defaults();
        private LogLevel logLevel = LogLevel.FATAL;
        private PrintStream output = System.out;
        private boolean captureOutput;
        private boolean emitJson;

        public Builder scriptTarget(ScriptTarget scriptTarget) {
            this.scriptTarget = scriptTarget;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder settings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder output(PrintStream output) {
            this.output = output;
            return this;
        }

        public Builder captureOutput(boolean captureOutput) {
            this.captureOutput = captureOutput;
            return this;
        }

        public Builder emitJson(boolean emitJson) {
            this.emitJson = emitJson;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(scriptTarget, workingDirectory, settings, logLevel, output, captureOutput, emitJson);
        }
    }
}
