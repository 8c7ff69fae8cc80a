package work.vernacular.kernel.flow;

/**
 * Result of executing a node or a body: the signal to propagate, the value carried by a return,
 * and the line that raised the signal.
 */
public record FlowOutcome(ControlSignal signal, Object value, int lineNumber) {
    public static final FlowOutcome NORMAL = new FlowOutcome(ControlSignal.NORMAL, null, 0);

    public FlowOutcome {
        if (signal == null) {
            signal = ControlSignal.NORMAL;
        }
    }

    public static FlowOutcome of(ControlSignal signal, int lineNumber) {
        return signal == ControlSignal.NORMAL ? NORMAL : new FlowOutcome(signal, null, lineNumber);
    }

    public static FlowOutcome returning(Object value, int lineNumber) {
        return new FlowOutcome(ControlSignal.RETURN, value, lineNumber);
    }

    public boolean isNormal() {
        return signal == ControlSignal.NORMAL;
    }
}
