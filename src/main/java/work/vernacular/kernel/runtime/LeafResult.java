package work.vernacular.kernel.runtime;

import work.vernacular.kernel.flow.ControlSignal;
import work.vernacular.kernel.flow.FlowOutcome;

/**
 * What a leaf command reports back to the engine: success or failure, an optional value, and the control signal
 * for the few commands that mean break/continue/return.
 */
public record LeafResult(boolean success, ControlSignal signal, Object value, String message) {
    private static final LeafResult DONE = new LeafResult(true, ControlSignal.NORMAL, null, null);

    public LeafResult {
        if (signal == null) {
            signal = ControlSignal.NORMAL;
        }
    }

    public static LeafResult done() {
        return DONE;
    }

    public static LeafResult value(Object value) {
        return new LeafResult(true, ControlSignal.NORMAL, value, null);
    }

    public static LeafResult failed(String message) {
        return new LeafResult(false, ControlSignal.NORMAL, null, message);
    }

    public static LeafResult breakLoop() {
        return new LeafResult(true, ControlSignal.BREAK, null, null);
    }

    public static LeafResult continueLoop() {
        return new LeafResult(true, ControlSignal.CONTINUE, null, null);
    }

    public static LeafResult returning(Object value) {
        return new LeafResult(true, ControlSignal.RETURN, value, null);
    }

    /**
     * Re-emits a signal produced by a nested command.
     */
    public static LeafResult propagate(FlowOutcome outcome) {
        if (outcome.isNormal()) {
            return DONE;
        }
        return new LeafResult(true, outcome.signal(), outcome.value(), null);
    }
}
