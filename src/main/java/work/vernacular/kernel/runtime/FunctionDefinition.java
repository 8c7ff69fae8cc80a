package work.vernacular.kernel.runtime;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import work.vernacular.kernel.parse.ScriptNode;

/**
 * User-defined function registered in the environment's function table. Never mutated after registration.
 */
public record FunctionDefinition(String name, List<String> parameters, List<ScriptNode> body, int lineNumber) {
    public FunctionDefinition {
        Objects.requireNonNull(name, "name");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        body = body == null ? List.of() : List.copyOf(body);
        if (new HashSet<>(parameters).size() != parameters.size()) {
            throw new IllegalArgumentException("parameter names must be distinct: " + parameters);
        }
    }

    public int arity() {
        return parameters.size();
    }
}
