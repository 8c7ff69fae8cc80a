package work.vernacular.kernel.flow;

/**
 * Unresolved variable, list or function name.
 */
public final class NameResolutionException extends ScriptErrorException {
    private final String name;

    public NameResolutionException(String name, String message) {
        super("name_error", message, 0);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
