package work.vernacular.kernel.parse;

import java.util.List;

/**
 * Writes a program back to script text with normalized indentation, and renders a whitespace-free
 * structural shape for comparing trees.
 */
public final class ProgramPrinter {
    private ProgramPrinter() {}

    public static String print(Program program, int indentWidth) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1");
        }
        var out = new StringBuilder();
        write(out, program.items(), 0, indentWidth);
        return out.toString();
    }

    public static String shape(Program program) {
        var out = new StringBuilder();
        shape(out, program.items());
        return out.toString();
    }

    private static void write(StringBuilder out, List<ScriptNode> nodes, int depth, int width) {
        for (var node : nodes) {
            out.append(" ".repeat(depth * width));
            if (node instanceof BlockNode block) {
                out.append(block.header()).append('\n');
                write(out, block.body(), depth + 1, width);
            } else if (node instanceof Command command) {
                out.append(command.text()).append('\n');
            }
        }
    }

    private static void shape(StringBuilder out, List<ScriptNode> nodes) {
        out.append('[');
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            var node = nodes.get(i);
            if (node instanceof BlockNode block) {
                out.append(block.spec()).append(' ');
                shape(out, block.body());
            } else if (node instanceof Command command) {
                out.append('"').append(command.text()).append('"');
            }
        }
        out.append(']');
    }
}
