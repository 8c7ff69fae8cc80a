package work.vernacular.kernel.runtime;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.vernacular.kernel.flow.NameResolutionException;
import work.vernacular.kernel.shared.KernelLog;
import work.vernacular.kernel.shared.LogLevel;

/**
 * State owned by one script run: scope stack, function table, settings, output stream and working directory.
 * Passed explicitly into the engine so separate runs stay isolated. Not thread-safe.
 */
public final class Environment {
    private final EngineSettings settings;
    private final ScopeStack scopes = new ScopeStack();
    private final Map<String, FunctionDefinition> functions = new LinkedHashMap<>();
    private final Path workingDirectory;
    private final PrintStream out;
    private final KernelLog log;

    public Environment() {
        this(EngineSettings.defaults(), null, System.out, KernelLog.stderr(LogLevel.FATAL));
    }

    public Environment(EngineSettings settings, Path workingDirectory, PrintStream out, KernelLog log) {
        this.settings = settings == null ? EngineSettings.defaults() : settings;
        this.workingDirectory = workingDirectory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : workingDirectory.toAbsolutePath().normalize();
        this.out = Objects.requireNonNull(out, "out");
        this.log = Objects.requireNonNull(log, "log");
    }

    public EngineSettings settings() {
        return settings;
    }

    public ScopeStack scopes() {
        return scopes;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    public PrintStream out() {
        return out;
    }

    public KernelLog log() {
        return log;
    }

    /**
     * Registers or replaces a function by name.
     */
    public void defineFunction(FunctionDefinition definition) {
        var previous = functions.put(definition.name(), definition);
        if (previous != null) {
            log.debug("function '%s' redefined (line %d replaces line %d)", definition.name(), definition.lineNumber(), previous.lineNumber());
        }
    }

    public FunctionDefinition function(String name) {
        var definition = functions.get(name);
        if (definition == null) {
            throw new NameResolutionException(name, "Function '" + name + "' is not defined");
        }
        return definition;
    }

    public boolean removeFunction(String name) {
        return functions.remove(name) != null;
    }

    public List<String> functionNames() {
        var names = new ArrayList<>(functions.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Clears every variable in every active frame and every function definition.
     */
    public void reset() {
        scopes.reset();
        functions.clear();
    }
}
