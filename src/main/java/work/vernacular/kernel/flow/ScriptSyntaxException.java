package work.vernacular.kernel.flow;

/**
 * Raised for block headers that end with {@code :} but match no known block form, and for misplaced {@code else:}.
 */
public final class ScriptSyntaxException extends ScriptErrorException {
    public ScriptSyntaxException(String message, int lineNumber) {
        super("syntax_error", message, lineNumber);
    }
}
