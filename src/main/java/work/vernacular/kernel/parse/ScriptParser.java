package work.vernacular.kernel.parse;

import java.util.List;

/**
 * Tokenizer and tree builder wired together.
 */
public final class ScriptParser {
    private final IndentationTokenizer tokenizer;

    public ScriptParser() {
        this(new IndentationTokenizer());
    }

    public ScriptParser(IndentationTokenizer tokenizer) {
        this.tokenizer = tokenizer;
    }

    public Program parse(String source) {
        return new BlockTreeBuilder().build(tokenizer.tokenize(source));
    }

    public Program parse(List<String> lines) {
        return new BlockTreeBuilder().build(tokenizer.tokenize(lines));
    }
}
