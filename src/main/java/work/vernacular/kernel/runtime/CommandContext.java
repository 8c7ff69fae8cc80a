package work.vernacular.kernel.runtime;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;
import work.vernacular.kernel.flow.FlowOutcome;

/**
 * Handed to the {@link CommandExecutor} for each call. Exposes the current scope and lets a leaf command run
 * nested command text (single-line loop bodies, {@code if ... then ...}) back through the engine.
 */
public final class CommandContext {
    private final Environment environment;
    private final int lineNumber;
    private final NestedRunner nestedRunner;

    public CommandContext(Environment environment, int lineNumber, NestedRunner nestedRunner) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.lineNumber = lineNumber;
        this.nestedRunner = nestedRunner == null
            ? (text, line) -> {
                throw new IllegalStateException("nested commands are unavailable in this context");
            }
            : nestedRunner;
    }

    public Environment environment() {
        return environment;
    }

    public ScopeStack scopes() {
        return environment.scopes();
    }

    public int lineNumber() {
        return lineNumber;
    }

    public PrintStream out() {
        return environment.out();
    }

    public Path workingDirectory() {
        return environment.workingDirectory();
    }

    public EngineSettings settings() {
        return environment.settings();
    }

    public void println(String text) {
        environment.out().println(text);
    }

    public Path resolvePath(String name) {
        return environment.workingDirectory().resolve(name).normalize();
    }

    public FlowOutcome runNested(String text) {
        return nestedRunner.run(text, lineNumber);
    }

    public interface NestedRunner {
        FlowOutcome run(String text, int lineNumber);
    }
}
