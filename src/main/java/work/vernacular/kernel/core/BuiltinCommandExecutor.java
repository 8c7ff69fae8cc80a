package work.vernacular.kernel.core;

import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Objects;
import work.vernacular.kernel.flow.NameResolutionException;
import work.vernacular.kernel.flow.ScriptErrorException;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.CommandExecutor;
import work.vernacular.kernel.runtime.LeafResult;

/**
 * Default {@link CommandExecutor}: a {@link CommandRegistry} of natural-language commands plus the
 * {@link ConditionEvaluator}. Script errors propagate; any other failure becomes a failed leaf result.
 */
public final class BuiltinCommandExecutor implements CommandExecutor {
    private final CommandRegistry registry;
    private final ConditionEvaluator conditions;

    public BuiltinCommandExecutor(CommandRegistry registry, ConditionEvaluator conditions) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
    }

    public static BuiltinCommandExecutor create() {
        var registry = new CommandRegistry();
        FlowCommands.register(registry);
        ListCommands.register(registry);
        FileCommands.register(registry);
        HttpCommands.register(registry);
        DateCommands.register(registry);
        VariableCommands.register(registry);
        MathCommands.register(registry);
        StringCommands.register(registry);
        OutputCommands.register(registry);
        return new BuiltinCommandExecutor(registry, new ConditionEvaluator());
    }

    public CommandRegistry registry() {
        return registry;
    }

    @Override
    public boolean evaluatePredicate(String condition, CommandContext ctx) {
        return conditions.evaluate(condition, ctx.scopes());
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<Object> resolveList(String name, CommandContext ctx) {
        var value = ctx.scopes().resolve(name.strip());
        if (value instanceof List<?> list) {
            return (List<Object>) list;
        }
        throw new NameResolutionException(name.strip(), "'" + name.strip() + "' is not a list");
    }

    @Override
    public LeafResult executeLeaf(String text, CommandContext ctx) {
        var match = registry.find(text);
        if (match.isEmpty()) {
            return LeafResult.failed("Unrecognized command: '" + text.strip() + "'");
        }
        try {
            return match.get().entry().handler().handle(ctx, match.get().matcher());
        } catch (ScriptErrorException ex) {
            throw ex;
        } catch (CommandFailedException ex) {
            return LeafResult.failed(ex.getMessage());
        } catch (NoSuchFileException ex) {
            return LeafResult.failed("File '" + ex.getFile() + "' not found");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return LeafResult.failed("Interrupted while running '" + text.strip() + "'");
        } catch (Exception ex) {
            var message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            return LeafResult.failed(match.get().entry().name() + ": " + message);
        }
    }
}
