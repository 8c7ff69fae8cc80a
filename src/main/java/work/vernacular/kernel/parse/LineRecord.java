package work.vernacular.kernel.parse;

/**
 * One significant source line: normalized indentation width, trimmed text and 1-based line number.
 */
public record LineRecord(int indent, String text, int lineNumber) {
    public LineRecord {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must be non-negative");
        }
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive");
        }
        text = text == null ? "" : text;
    }
}
