package work.vernacular.kernel.runtime;

/**
 * Kinds of scope frames. Only {@link #GLOBAL} and {@link #FUNCTION} frames own bindings; a {@link #LOOP} frame
 * marks a loop body and writes through to the frame below it.
 */
public enum ScopeKind {
    GLOBAL,
    FUNCTION,
    LOOP;

    public boolean ownsBindings() {
        return this != LOOP;
    }
}
