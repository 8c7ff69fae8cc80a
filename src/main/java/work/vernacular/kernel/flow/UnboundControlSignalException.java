package work.vernacular.kernel.flow;

/**
 * A break/continue with no enclosing loop, or a signal escaping a function body.
 */
public final class UnboundControlSignalException extends ScriptErrorException {
    private final ControlSignal signal;

    public UnboundControlSignalException(ControlSignal signal, String message, int lineNumber) {
        super("unbound_control_signal", message, lineNumber);
        this.signal = signal;
    }

    public ControlSignal signal() {
        return signal;
    }
}
