package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * Text transformations. The subject is quoted text or a variable; the result is stored in {@code result}.
 */
public final class StringCommands {
    private StringCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("string/case", "make (.+) (uppercase|lowercase)", StringCommands::changeCase);
        registry.register("string/length", "get the length of (.+)", StringCommands::length);
        registry.register("string/reverse", "reverse (.+)", StringCommands::reverse);
        registry.register("string/replace", "replace (.+?) with (.+?) in (.+)", StringCommands::replace);
        registry.register("string/split", "split (.+?) by (.+)", StringCommands::split);
        registry.register("string/join", "join list (\\w+) with (.+)", StringCommands::join);
        return registry;
    }

    private static LeafResult changeCase(CommandContext ctx, Matcher m) {
        var text = Operands.text(ctx.scopes(), m.group(1));
        var upper = m.group(2).equalsIgnoreCase("uppercase");
        var result = upper ? text.toUpperCase(Locale.ROOT) : text.toLowerCase(Locale.ROOT);
        ctx.println("'" + text + "' in " + m.group(2).toLowerCase(Locale.ROOT) + ": '" + result + "'");
        return store(ctx, result);
    }

    private static LeafResult length(CommandContext ctx, Matcher m) {
        var text = Operands.text(ctx.scopes(), m.group(1));
        long length = text.codePointCount(0, text.length());
        ctx.println("Length of '" + text + "': " + length);
        return store(ctx, length);
    }

    private static LeafResult reverse(CommandContext ctx, Matcher m) {
        var text = Operands.text(ctx.scopes(), m.group(1));
        var result = new StringBuilder(text).reverse().toString();
        ctx.println("'" + text + "' reversed: '" + result + "'");
        return store(ctx, result);
    }

    private static LeafResult replace(CommandContext ctx, Matcher m) {
        var target = Operands.text(ctx.scopes(), m.group(1));
        var replacement = Operands.text(ctx.scopes(), m.group(2));
        var source = Operands.text(ctx.scopes(), m.group(3));
        var result = source.replace(target, replacement);
        ctx.println("Replaced '" + target + "' with '" + replacement + "' in '" + source + "': '" + result + "'");
        return store(ctx, result);
    }

    private static LeafResult split(CommandContext ctx, Matcher m) {
        var text = Operands.text(ctx.scopes(), m.group(1));
        var delimiter = Operands.text(ctx.scopes(), m.group(2));
        if (delimiter.isEmpty()) {
            throw new CommandFailedException("Cannot split by an empty delimiter");
        }
        var parts = new ArrayList<Object>();
        for (var part : text.split(Pattern.quote(delimiter), -1)) {
            parts.add(part);
        }
        ctx.println("Split '" + text + "' by '" + delimiter + "': " + Values.format(parts));
        return store(ctx, parts);
    }

    private static LeafResult join(CommandContext ctx, Matcher m) {
        var list = Operands.list(ctx.scopes(), m.group(1));
        var separator = Operands.text(ctx.scopes(), m.group(2));
        var joined = new StringBuilder();
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                joined.append(separator);
            }
            joined.append(Values.format(list.get(i)));
        }
        ctx.println(joined.toString());
        return store(ctx, joined.toString());
    }

    private static LeafResult store(CommandContext ctx, Object value) {
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, value);
        return LeafResult.value(value);
    }
}
