package work.vernacular.kernel.core;

import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.vernacular.kernel.flow.NameResolutionException;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * Variable assignment, arithmetic updates, type inspection and conversion, plus removal of variables and functions.
 * Assignment goes through {@link work.vernacular.kernel.runtime.ScopeStack#assign}, so inside a function it only
 * touches the function's own frame.
 */
public final class VariableCommands {
    private static final Pattern ARITHMETIC = Pattern.compile(
        "(.+?) (plus|minus|times|multiplied by|divided by) (.+)", Pattern.CASE_INSENSITIVE);

    private VariableCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("variables/set", "set (\\w+) to (.+)", VariableCommands::set);
        registry.register("variables/create", "create (?:a )?variable (?:called )?(\\w+) (?:with value |= ?)(.+)", VariableCommands::set);
        registry.register("variables/increase", "increase (\\w+) by (.+)", (ctx, m) -> adjust(ctx, m.group(1), m.group(2), 1));
        registry.register("variables/decrease", "decrease (\\w+) by (.+)", (ctx, m) -> adjust(ctx, m.group(1), m.group(2), -1));
        registry.register("variables/delete", "delete variable (\\w+)", VariableCommands::delete);
        registry.register("variables/type", "(?:check (?:the )?type of|what (?:is the )?type of) (\\w+)\\??", VariableCommands::typeOf);
        registry.register("variables/convert", "convert (\\w+) to (string|number|boolean)", VariableCommands::convert);
        registry.register("variables/list", "list (?:all )?variables", VariableCommands::listVariables);
        registry.register("variables/functions", "list (?:all )?functions", VariableCommands::listFunctions);
        registry.register("variables/delete-function", "delete (?:the )?function (\\w+)", VariableCommands::deleteFunction);
        registry.register("variables/reset", "reset everything", VariableCommands::resetAll);
        return registry;
    }

    private static LeafResult set(CommandContext ctx, Matcher m) {
        var name = m.group(1);
        var value = evaluate(ctx, m.group(2).strip());
        ctx.scopes().assign(name, value);
        return LeafResult.value(value);
    }

    /**
     * Right-hand side of {@code set}: quoted text, a number, a boolean, arithmetic, or an existing variable.
     * An unknown name is a {@link NameResolutionException}; unquoted phrases are rejected.
     */
    static Object evaluate(CommandContext ctx, String expression) {
        if (Values.isQuoted(expression) || Values.isNumeric(expression)) {
            return Values.parseLiteral(expression);
        }
        var arithmetic = ARITHMETIC.matcher(expression);
        if (arithmetic.matches()) {
            var left = Operands.number(ctx.scopes(), arithmetic.group(1));
            var right = Operands.number(ctx.scopes(), arithmetic.group(3));
            return Values.normalize(apply(arithmetic.group(2).toLowerCase(Locale.ROOT), left, right));
        }
        if (Values.isIdentifier(expression)) {
            var scopes = ctx.scopes();
            if (scopes.isDefined(expression)) {
                return scopes.resolve(expression);
            }
            if ("true".equalsIgnoreCase(expression) || "false".equalsIgnoreCase(expression)) {
                return Boolean.parseBoolean(expression.toLowerCase(Locale.ROOT));
            }
            throw new NameResolutionException(expression, "Variable '" + expression + "' is not defined");
        }
        throw new CommandFailedException("Cannot use '" + expression + "' as a value; put text in quotes");
    }

    private static double apply(String operator, double left, double right) {
        switch (operator) {
            case "plus":
                return left + right;
            case "minus":
                return left - right;
            case "divided by":
                if (right == 0) {
                    throw new CommandFailedException("Cannot divide by zero");
                }
                return left / right;
            default:
                return left * right;
        }
    }

    private static LeafResult adjust(CommandContext ctx, String name, String amount, int sign) {
        var scopes = ctx.scopes();
        if (!scopes.isDefined(name)) {
            throw new CommandFailedException("Variable '" + name + "' is not defined");
        }
        var current = Values.asNumber(scopes.resolve(name))
            .orElseThrow(() -> new CommandFailedException("Variable '" + name + "' is not a number"));
        var updated = Values.normalize(current + sign * Operands.number(scopes, amount));
        scopes.assign(name, updated);
        return LeafResult.value(updated);
    }

    private static LeafResult delete(CommandContext ctx, Matcher m) {
        if (!ctx.scopes().remove(m.group(1))) {
            throw new CommandFailedException("Variable '" + m.group(1) + "' is not defined");
        }
        return LeafResult.done();
    }

    private static LeafResult typeOf(CommandContext ctx, Matcher m) {
        var value = Operands.value(ctx.scopes(), m.group(1));
        var type = Values.typeName(value);
        ctx.println("Variable '" + m.group(1) + "' is of type: " + type);
        return LeafResult.value(type);
    }

    private static LeafResult convert(CommandContext ctx, Matcher m) {
        var name = m.group(1);
        var value = Operands.value(ctx.scopes(), name);
        Object converted;
        switch (m.group(2).toLowerCase(Locale.ROOT)) {
            case "string":
                converted = Values.format(value);
                break;
            case "number":
                converted = Values.asNumber(value)
                    .map(Values::normalize)
                    .orElseThrow(() -> new CommandFailedException("Cannot convert '" + Values.format(value) + "' to a number"));
                break;
            default:
                converted = toBoolean(value);
                break;
        }
        ctx.scopes().assign(name, converted);
        return LeafResult.value(converted);
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        var text = Values.format(value).strip().toLowerCase(Locale.ROOT);
        return text.equals("true") || text.equals("yes") || text.equals("1");
    }

    private static LeafResult deleteFunction(CommandContext ctx, Matcher m) {
        if (!ctx.environment().removeFunction(m.group(1))) {
            throw new CommandFailedException("Function '" + m.group(1) + "' is not defined");
        }
        ctx.println("Function '" + m.group(1) + "' deleted");
        return LeafResult.done();
    }

    private static LeafResult resetAll(CommandContext ctx, Matcher m) {
        ctx.environment().reset();
        ctx.println("All variables, lists, and functions have been reset.");
        return LeafResult.done();
    }

    private static LeafResult listVariables(CommandContext ctx, Matcher m) {
        var snapshot = ctx.scopes().snapshot();
        if (snapshot.isEmpty()) {
            ctx.println("No variables defined");
            return LeafResult.done();
        }
        snapshot.keySet().stream().sorted().forEach(name -> ctx.println(name + " = " + Values.format(snapshot.get(name))));
        return LeafResult.done();
    }

    private static LeafResult listFunctions(CommandContext ctx, Matcher m) {
        var names = ctx.environment().functionNames();
        var joiner = new StringJoiner(", ");
        names.forEach(joiner::add);
        ctx.println(names.isEmpty() ? "No functions defined" : "Functions: " + joiner);
        return LeafResult.done();
    }
}
