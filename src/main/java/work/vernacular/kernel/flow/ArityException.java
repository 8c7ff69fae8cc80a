package work.vernacular.kernel.flow;

public final class ArityException extends ScriptErrorException {
    private final int expected;
    private final int actual;

    public ArityException(String function, int expected, int actual) {
        super("arity_error", "Function '" + function + "' expects " + expected + " argument(s) but got " + actual, 0);
        this.expected = expected;
        this.actual = actual;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
