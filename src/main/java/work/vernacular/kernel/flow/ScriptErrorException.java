package work.vernacular.kernel.flow;

/**
 * Base type for block-structural failures. Carries a stable error code and the script line it originated from.
 */
public class ScriptErrorException extends RuntimeException {
    private final String code;
    private int lineNumber;

    public ScriptErrorException(String code, String message, int lineNumber) {
        super(message);
        this.code = code;
        this.lineNumber = Math.max(lineNumber, 0);
    }

    public ScriptErrorException(String code, String message, int lineNumber, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.lineNumber = Math.max(lineNumber, 0);
    }

    public String code() {
        return code;
    }

    /**
     * Line the failure was raised on, or 0 when the raising code had no line to report.
     */
    public int lineNumber() {
        return lineNumber;
    }

    public String detail() {
        return super.getMessage();
    }

    /**
     * Attaches a line number if none was recorded yet; the innermost line always wins.
     */
    public ScriptErrorException atLine(int line) {
        if (this.lineNumber == 0 && line > 0) {
            this.lineNumber = line;
        }
        return this;
    }

    @Override
    public String getMessage() {
        return lineNumber > 0 ? "line " + lineNumber + ": " + detail() : detail();
    }
}
