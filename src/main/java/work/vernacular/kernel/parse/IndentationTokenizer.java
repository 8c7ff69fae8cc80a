package work.vernacular.kernel.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.vernacular.kernel.flow.IndentationException;

/**
 * Turns raw script lines into {@link LineRecord}s. Blank and comment lines are dropped before indentation
 * is measured; a tab counts as {@code tabWidth} columns.
 */
public final class IndentationTokenizer {
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final List<String> DEFAULT_COMMENT_MARKERS = List.of("#", "//");

    private final int tabWidth;
    private final List<String> commentMarkers;

    public IndentationTokenizer() {
        this(DEFAULT_TAB_WIDTH, DEFAULT_COMMENT_MARKERS);
    }

    public IndentationTokenizer(int tabWidth, List<String> commentMarkers) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be at least 1");
        }
        this.tabWidth = tabWidth;
        this.commentMarkers = List.copyOf(Objects.requireNonNull(commentMarkers, "commentMarkers"));
    }

    public List<LineRecord> tokenize(String source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return tokenize(List.of(source.split("\\R", -1)));
    }

    public List<LineRecord> tokenize(List<String> lines) {
        var records = new ArrayList<LineRecord>();
        for (int index = 0; index < lines.size(); index++) {
            var raw = lines.get(index);
            if (raw == null) {
                continue;
            }
            if (index == 0 && raw.startsWith("\uFEFF")) {
                raw = raw.substring(1);
            }
            var text = raw.strip();
            if (text.isEmpty() || isComment(text)) {
                continue;
            }
            records.add(new LineRecord(measure(raw, index + 1), text, index + 1));
        }
        return records;
    }

    /**
     * Width of the leading whitespace of {@code line}. Leading whitespace other than spaces and tabs is rejected
     * since it has no agreed width.
     */
    public int measure(String line, int lineNumber) {
        int indent = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                indent += 1;
            } else if (ch == '\t') {
                indent += tabWidth;
            } else if (Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                throw new IndentationException(
                    "unsupported whitespace character U+" + String.format("%04X", (int) ch) + " in indentation",
                    lineNumber
                );
            } else {
                break;
            }
        }
        return indent;
    }

    private boolean isComment(String text) {
        for (var marker : commentMarkers) {
            if (text.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }
}
