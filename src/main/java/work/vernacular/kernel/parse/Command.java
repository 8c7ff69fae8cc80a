package work.vernacular.kernel.parse;

import java.util.Objects;

/**
 * Leaf command line, owned by the enclosing block body or by the program.
 */
public record Command(String text, int lineNumber, int indent) implements ScriptNode {
    public Command {
        Objects.requireNonNull(text, "text");
    }
}
