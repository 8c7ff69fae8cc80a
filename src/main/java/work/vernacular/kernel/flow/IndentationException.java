package work.vernacular.kernel.flow;

/**
 * Raised when a line's indentation cannot be reconciled with the open blocks.
 */
public final class IndentationException extends ScriptErrorException {
    public IndentationException(String message, int lineNumber) {
        super("indentation_error", message, lineNumber);
    }
}
