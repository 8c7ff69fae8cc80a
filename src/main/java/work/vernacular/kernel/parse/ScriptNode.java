package work.vernacular.kernel.parse;

/**
 * Element of a program or block body: either a leaf {@link Command} or a nested {@link BlockNode}.
 */
public interface ScriptNode {
    int indent();

    int lineNumber();
}
