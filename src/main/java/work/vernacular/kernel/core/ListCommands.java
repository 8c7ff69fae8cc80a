package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.regex.Matcher;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * Lists are ordinary variables holding a {@code List}; {@code for each} blocks iterate them by name.
 */
public final class ListCommands {
    private ListCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("list/create-empty", "create (?:an? )?(?:empty )?list (?:called )?(\\w+)", ListCommands::createEmpty);
        registry.register("list/create", "create (?:a )?list (?:called )?(\\w+) with (.+)", ListCommands::create);
        registry.register("list/add", "add (.+) to (?:the )?list (\\w+)", ListCommands::add);
        registry.register("list/remove", "remove (.+) from (?:the )?list (\\w+)", ListCommands::remove);
        registry.register("list/show", "show (?:the )?list (\\w+)", ListCommands::show);
        registry.register("list/size", "get the (?:size|length) of (?:the )?list (\\w+)", ListCommands::size);
        registry.register("list/delete", "delete list (\\w+)", ListCommands::delete);
        return registry;
    }

    private static LeafResult createEmpty(CommandContext ctx, Matcher m) {
        ctx.scopes().assign(m.group(1), new ArrayList<>());
        return LeafResult.done();
    }

    private static LeafResult create(CommandContext ctx, Matcher m) {
        var items = Operands.items(m.group(2));
        ctx.scopes().assign(m.group(1), items);
        return LeafResult.value(items);
    }

    private static LeafResult add(CommandContext ctx, Matcher m) {
        var list = Operands.list(ctx.scopes(), m.group(2));
        var item = Operands.valueOrText(ctx.scopes(), m.group(1));
        list.add(item);
        return LeafResult.done();
    }

    private static LeafResult remove(CommandContext ctx, Matcher m) {
        var list = Operands.list(ctx.scopes(), m.group(2));
        var item = Operands.valueOrText(ctx.scopes(), m.group(1));
        for (int i = 0; i < list.size(); i++) {
            if (Values.looselyEquals(list.get(i), item)) {
                list.remove(i);
                return LeafResult.done();
            }
        }
        throw new CommandFailedException("'" + Values.format(item) + "' is not in list '" + m.group(2) + "'");
    }

    private static LeafResult show(CommandContext ctx, Matcher m) {
        var list = Operands.list(ctx.scopes(), m.group(1));
        ctx.println(m.group(1) + ": " + Values.format(list));
        return LeafResult.done();
    }

    private static LeafResult size(CommandContext ctx, Matcher m) {
        var list = Operands.list(ctx.scopes(), m.group(1));
        long size = list.size();
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, size);
        ctx.println("List '" + m.group(1) + "' has " + size + " items");
        return LeafResult.value(size);
    }

    private static LeafResult delete(CommandContext ctx, Matcher m) {
        Operands.list(ctx.scopes(), m.group(1));
        ctx.scopes().remove(m.group(1));
        return LeafResult.done();
    }
}
