package work.vernacular.kernel.core;

import java.util.regex.Matcher;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.LeafResult;

/**
 * Handler bound to a command pattern in the {@link CommandRegistry}.
 */
@FunctionalInterface
public interface LeafHandler {
    LeafResult handle(CommandContext ctx, Matcher match) throws Exception;
}
