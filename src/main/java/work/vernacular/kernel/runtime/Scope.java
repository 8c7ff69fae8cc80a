package work.vernacular.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One frame of the scope stack.
 */
public final class Scope {
    private final ScopeKind kind;
    private final Map<String, Object> bindings = new LinkedHashMap<>();

    Scope(ScopeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ScopeKind kind() {
        return kind;
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    public Object get(String name) {
        return bindings.get(name);
    }

    void put(String name, Object value) {
        if (!kind.ownsBindings()) {
            throw new IllegalStateException(kind + " scope does not hold bindings");
        }
        bindings.put(name, value);
    }

    boolean remove(String name) {
        if (!bindings.containsKey(name)) {
            return false;
        }
        bindings.remove(name);
        return true;
    }

    void clear() {
        bindings.clear();
    }

    public Map<String, Object> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
