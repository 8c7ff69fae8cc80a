package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.List;
import work.vernacular.kernel.runtime.ScopeStack;
import work.vernacular.kernel.shared.Values;

/**
 * Operand resolution for leaf commands: quoted text, numbers, or variable names.
 */
final class Operands {
    private Operands() {}

    static Object value(ScopeStack scopes, String raw) {
        var text = raw == null ? "" : raw.strip();
        if (Values.isQuoted(text) || Values.isNumeric(text)) {
            return Values.parseLiteral(text);
        }
        if (Values.isIdentifier(text)) {
            if (scopes.isDefined(text)) {
                return scopes.resolve(text);
            }
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text.toLowerCase());
            }
            throw new CommandFailedException("Variable '" + text + "' is not defined");
        }
        return text;
    }

    /**
     * Like {@link #value} but unknown bare words are taken as literal text.
     */
    static Object valueOrText(ScopeStack scopes, String raw) {
        var text = raw == null ? "" : raw.strip();
        if (Values.isIdentifier(text) && scopes.isDefined(text)) {
            return scopes.resolve(text);
        }
        return Values.parseLiteral(text);
    }

    static double number(ScopeStack scopes, String raw) {
        var value = value(scopes, raw);
        return Values.asNumber(value)
            .orElseThrow(() -> new CommandFailedException("'" + raw.strip() + "' is not a number"));
    }

    static String text(ScopeStack scopes, String raw) {
        return Values.format(value(scopes, raw));
    }

    @SuppressWarnings("unchecked")
    static List<Object> list(ScopeStack scopes, String name) {
        var value = scopes.lookup(name.strip()).orElse(null);
        if (!scopes.isDefined(name.strip())) {
            throw new CommandFailedException("List '" + name.strip() + "' doesn't exist");
        }
        if (!(value instanceof List<?>)) {
            throw new CommandFailedException("'" + name.strip() + "' is not a list");
        }
        return (List<Object>) value;
    }

    /**
     * Parses comma separated items: quotes are stripped, numbers become numbers.
     */
    static List<Object> items(String raw) {
        var items = new ArrayList<Object>();
        for (var item : Values.splitList(raw)) {
            if (!item.isEmpty()) {
                items.add(Values.parseLiteral(item));
            }
        }
        return items;
    }

    /**
     * Numbers from either a list variable name or a comma separated literal list.
     */
    static List<Double> numbers(ScopeStack scopes, String raw) {
        var text = raw.strip();
        List<?> source;
        if (Values.isIdentifier(text) && scopes.lookup(text).orElse(null) instanceof List<?> list) {
            source = list;
        } else {
            var resolved = new ArrayList<Object>();
            for (var item : Values.splitList(text)) {
                resolved.add(value(scopes, item));
            }
            source = resolved;
        }
        var numbers = new ArrayList<Double>(source.size());
        for (var item : source) {
            numbers.add(Values.asNumber(item)
                .orElseThrow(() -> new CommandFailedException("'" + Values.format(item) + "' is not a number")));
        }
        if (numbers.isEmpty()) {
            throw new CommandFailedException("no numbers given");
        }
        return numbers;
    }
}
