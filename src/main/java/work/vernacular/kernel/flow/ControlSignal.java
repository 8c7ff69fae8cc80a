package work.vernacular.kernel.flow;

/**
 * Control-flow intent threaded out of body execution.
 */
public enum ControlSignal {
    NORMAL,
    BREAK,
    CONTINUE,
    RETURN;

    public boolean isLoopSignal() {
        return this == BREAK || this == CONTINUE;
    }
}
