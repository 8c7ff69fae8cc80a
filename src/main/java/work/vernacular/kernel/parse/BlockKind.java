package work.vernacular.kernel.parse;

public enum BlockKind {
    IF,
    ELSE,
    FOR_EACH,
    WHILE,
    REPEAT,
    FUNCTION_DEF;

    public boolean isLoop() {
        return this == FOR_EACH || this == WHILE || this == REPEAT;
    }
}
