package work.vernacular.kernel.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.vernacular.kernel.flow.NameResolutionException;

/**
 * Stack of variable scopes with exactly one global frame at the bottom.
 *
 * <p>Lookups walk every binding frame from the innermost activation down to global, so a function body reads its
 * caller's locals. Writes always land in the innermost binding frame: a function works on its own copy-on-write
 * view and nothing it assigns is visible to the caller once it returns. Loop frames share the frame below them, so
 * a value set inside a loop body stays visible after the loop.</p>
 */
public final class ScopeStack {
    private final Deque<Scope> frames = new ArrayDeque<>();
    private final Scope global = new Scope(ScopeKind.GLOBAL);

    public ScopeStack() {
        frames.push(global);
    }

    public void push(ScopeKind kind) {
        if (kind == ScopeKind.GLOBAL) {
            throw new IllegalArgumentException("only one global scope is allowed");
        }
        frames.push(new Scope(kind));
    }

    public Scope pop() {
        if (frames.size() == 1) {
            throw new IllegalStateException("the global scope cannot be popped");
        }
        return frames.pop();
    }

    public int depth() {
        return frames.size();
    }

    public Scope global() {
        return global;
    }

    /**
     * Frame that receives new bindings: the innermost frame that owns bindings.
     */
    public Scope current() {
        for (var frame : frames) {
            if (frame.kind().ownsBindings()) {
                return frame;
            }
        }
        return global;
    }

    public void bind(String name, Object value) {
        current().put(name, value);
    }

    /**
     * Sets {@code name} in the current activation. An outer binding of the same name is shadowed, never modified.
     */
    public void assign(String name, Object value) {
        current().put(name, value);
    }

    public Object resolve(String name) {
        for (var frame : visible()) {
            if (frame.contains(name)) {
                return frame.get(name);
            }
        }
        throw new NameResolutionException(name, "Variable '" + name + "' is not defined");
    }

    public Optional<Object> lookup(String name) {
        for (var frame : visible()) {
            if (frame.contains(name)) {
                return Optional.ofNullable(frame.get(name));
            }
        }
        return Optional.empty();
    }

    public boolean isDefined(String name) {
        for (var frame : visible()) {
            if (frame.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Removes a binding of the current activation; outer frames are left untouched.
     */
    public boolean remove(String name) {
        return current().remove(name);
    }

    /**
     * Visible bindings merged outermost first, so inner values win.
     */
    public Map<String, Object> snapshot() {
        var merged = new LinkedHashMap<String, Object>();
        var visible = visible();
        for (int i = visible.size() - 1; i >= 0; i--) {
            merged.putAll(visible.get(i).bindings());
        }
        return merged;
    }

    /**
     * Clears the bindings of every frame. The frames themselves stay, so active loops and calls unwind normally.
     */
    public void reset() {
        for (var frame : frames) {
            frame.clear();
        }
    }

    private List<Scope> visible() {
        var visible = new ArrayList<Scope>(frames.size());
        for (var frame : frames) {
            if (frame.kind().ownsBindings()) {
                visible.add(frame);
            }
        }
        return visible;
    }
}
