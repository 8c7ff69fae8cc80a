package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * {@code print}, {@code display}, {@code show} and {@code output}. Registered last: the bare-words form
 * accepts anything.
 */
public final class OutputCommands {
    private static final Pattern PREFIX = Pattern.compile("^(?:the words? |the value of |value of |the )", Pattern.CASE_INSENSITIVE);

    private OutputCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("output/print", "(?:print|display|output|show(?: me)?)\\s+(.+)", OutputCommands::print);
        return registry;
    }

    private static LeafResult print(CommandContext ctx, Matcher m) {
        var argument = PREFIX.matcher(m.group(1).strip()).replaceFirst("");
        var parts = splitConcatenation(argument);
        var text = new StringBuilder();
        if (parts.size() > 1) {
            for (var part : parts) {
                text.append(Operands.text(ctx.scopes(), part));
            }
        } else if (Values.isQuoted(argument)) {
            text.append(Values.unquote(argument));
        } else if (Values.isIdentifier(argument)) {
            text.append(Operands.text(ctx.scopes(), argument));
        } else {
            text.append(argument);
        }
        ctx.println(text.toString());
        return LeafResult.done();
    }

    /**
     * {@code "Total: " + total}: splits on {@code +} outside quotes. Unquoted arithmetic such as {@code 1 + 2}
     * is left alone unless a quoted part is present.
     */
    static List<String> splitConcatenation(String text) {
        var parts = new ArrayList<String>();
        var current = new StringBuilder();
        boolean sawQuote = false;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
                current.append(ch);
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
                sawQuote = true;
                current.append(ch);
            } else if (ch == '+') {
                parts.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        parts.add(current.toString().strip());
        if (!sawQuote || parts.stream().anyMatch(String::isEmpty)) {
            return List.of(text);
        }
        return parts;
    }
}
