package work.vernacular.kernel.runtime;

import java.util.List;

/**
 * Collaborator that gives leaf command text its meaning. The engine only relies on this contract; the grammar of
 * individual commands is entirely up to the implementation.
 */
public interface CommandExecutor {
    /**
     * Evaluates a header condition.
     *
     * @throws work.vernacular.kernel.flow.EvaluationException for unknown operators or malformed conditions
     */
    boolean evaluatePredicate(String condition, CommandContext ctx);

    /**
     * Resolves a list name to its ordered elements.
     *
     * @throws work.vernacular.kernel.flow.NameResolutionException when no such list exists
     */
    List<Object> resolveList(String name, CommandContext ctx);

    /**
     * Performs the effect named by {@code text}. Failures of the effect itself are reported through
     * {@link LeafResult#failed(String)}, not thrown.
     */
    LeafResult executeLeaf(String text, CommandContext ctx);
}
