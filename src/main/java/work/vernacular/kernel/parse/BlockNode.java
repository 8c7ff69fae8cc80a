package work.vernacular.kernel.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Header line plus the ordered body nested under it. The body is owned exclusively by this node; the parent
 * is only remembered by its header line number (0 for top level) for diagnostics.
 */
public final class BlockNode implements ScriptNode {
    private final String header;
    private final BlockHeader spec;
    private final int indent;
    private final int lineNumber;
    private final int parentLine;
    private final List<ScriptNode> body = new ArrayList<>();

    public BlockNode(String header, BlockHeader spec, int indent, int lineNumber, int parentLine) {
        this.header = Objects.requireNonNull(header, "header");
        this.spec = Objects.requireNonNull(spec, "spec");
        this.indent = indent;
        this.lineNumber = lineNumber;
        this.parentLine = parentLine;
    }

    public String header() {
        return header;
    }

    public BlockHeader spec() {
        return spec;
    }

    public BlockKind kind() {
        return spec.kind();
    }

    @Override
    public int indent() {
        return indent;
    }

    @Override
    public int lineNumber() {
        return lineNumber;
    }

    public int parentLine() {
        return parentLine;
    }

    public List<ScriptNode> body() {
        return Collections.unmodifiableList(body);
    }

    void append(ScriptNode child) {
        if (child.indent() <= indent) {
            throw new IllegalArgumentException("child at indent " + child.indent() + " cannot nest under indent " + indent);
        }
        body.add(child);
    }

    @Override
    public String toString() {
        return "BlockNode[" + kind() + " line " + lineNumber + ", " + body.size() + " child(ren)]";
    }
}
