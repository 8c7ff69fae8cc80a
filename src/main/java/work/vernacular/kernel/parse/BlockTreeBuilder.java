package work.vernacular.kernel.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import work.vernacular.kernel.flow.IndentationException;
import work.vernacular.kernel.flow.ScriptSyntaxException;

/**
 * Builds the block tree from tokenized lines using indentation deltas.
 *
 * <p>Each open block remembers the indent of its first child; later siblings must match it exactly. A line at or
 * below a block's header indent closes that block. {@code else:} is appended next to the {@code if} it belongs to,
 * which must be the last node already present at the same level.</p>
 */
public final class BlockTreeBuilder {

    public Program build(List<LineRecord> lines) {
        var root = new Frame(-1, null);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(root);

        for (var line : lines) {
            while (stack.size() > 1 && line.indent() <= stack.peek().headerIndent) {
                stack.pop();
            }
            var frame = stack.peek();
            boolean header = HeaderResolver.isHeaderLine(line.text());
            checkIndent(frame, line, header && HeaderResolver.isElse(line.text()));

            if (header) {
                var spec = HeaderResolver.resolveOrThrow(line.text(), line.lineNumber());
                if (spec instanceof BlockHeader.Else) {
                    requireMatchingIf(frame, line);
                }
                var node = new BlockNode(line.text(), spec, line.indent(), line.lineNumber(), frame.ownerLine());
                frame.add(node);
                stack.push(new Frame(line.indent(), node));
            } else {
                frame.add(new Command(line.text(), line.lineNumber(), line.indent()));
            }
        }
        return new Program(root.topLevel);
    }

    private static void checkIndent(Frame frame, LineRecord line, boolean elseLine) {
        if (frame.childIndent < 0) {
            frame.childIndent = line.indent();
            return;
        }
        if (line.indent() == frame.childIndent) {
            return;
        }
        if (elseLine) {
            throw new ScriptSyntaxException("else: does not line up with any if at indent " + line.indent(), line.lineNumber());
        }
        if (line.indent() > frame.childIndent) {
            throw new IndentationException(
                "unexpected indent " + line.indent() + " (expected " + frame.childIndent + ")",
                line.lineNumber()
            );
        }
        throw new IndentationException(
            "unindent to " + line.indent() + " does not match any outer indentation level",
            line.lineNumber()
        );
    }

    private static void requireMatchingIf(Frame frame, LineRecord line) {
        var previous = frame.last();
        if (previous instanceof BlockNode block && block.kind() == BlockKind.IF) {
            return;
        }
        throw new ScriptSyntaxException("else: without a matching if at the same indentation", line.lineNumber());
    }

    private static final class Frame {
        private final int headerIndent;
        private final BlockNode node;
        private final List<ScriptNode> topLevel = new ArrayList<>();
        private int childIndent = -1;

        private Frame(int headerIndent, BlockNode node) {
            this.headerIndent = headerIndent;
            this.node = node;
        }

        void add(ScriptNode child) {
            if (node == null) {
                topLevel.add(child);
            } else {
                node.append(child);
            }
        }

        ScriptNode last() {
            var body = node == null ? topLevel : node.body();
            return body.isEmpty() ? null : body.get(body.size() - 1);
        }

        int ownerLine() {
            return node == null ? 0 : node.lineNumber();
        }
    }
}
