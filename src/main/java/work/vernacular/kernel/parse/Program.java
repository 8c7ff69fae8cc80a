package work.vernacular.kernel.parse;

import java.util.List;

/**
 * Parse result for one script: the ordered top-level commands and blocks.
 */
public record Program(List<ScriptNode> items) {
    public Program {
        items = items == null ? List.of() : List.copyOf(items);
    }

    /**
     * Number of source lines represented by the tree, headers included.
     */
    public int lineCount() {
        return count(items);
    }

    public boolean hasBlocks() {
        return items.stream().anyMatch(BlockNode.class::isInstance);
    }

    private static int count(List<ScriptNode> nodes) {
        int total = 0;
        for (var node : nodes) {
            total += 1;
            if (node instanceof BlockNode block) {
                total += count(block.body());
            }
        }
        return total;
    }
}
