package work.vernacular.kernel.core;

/**
 * Thrown by leaf handlers when the command itself fails (missing file, non-numeric operand, ...).
 * Turned into a failed leaf result by {@link BuiltinCommandExecutor}; never fatal to the run.
 */
public final class CommandFailedException extends RuntimeException {
    public CommandFailedException(String message) {
        super(message);
    }

    public CommandFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
