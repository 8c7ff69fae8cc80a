package work.vernacular.kernel.flow;

/**
 * Malformed or unsupported condition expression.
 */
public final class EvaluationException extends ScriptErrorException {
    public EvaluationException(String message) {
        super("evaluation_error", message, 0);
    }
}
