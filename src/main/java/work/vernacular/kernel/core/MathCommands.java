package work.vernacular.kernel.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;
import java.util.regex.Matcher;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.runtime.LeafResult;
import work.vernacular.kernel.shared.Values;

/**
 * Arithmetic commands. Operands are numbers or numeric variables; every result is printed and stored in
 * {@code result}.
 */
public final class MathCommands {
    static final int MAX_FACTORIAL = 170;

    private MathCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        registry.register("math/add", "add (\\S+) and (\\S+)", (ctx, m) -> binary(ctx, m.group(1), m.group(2), "+", Double::sum));
        registry.register("math/plus", "calculate (\\S+) \\+ (\\S+)", (ctx, m) -> binary(ctx, m.group(1), m.group(2), "+", Double::sum));
        registry.register("math/subtract", "subtract (\\S+) from (\\S+)", (ctx, m) -> binary(ctx, m.group(2), m.group(1), "-", (a, b) -> a - b));
        registry.register("math/multiply", "multiply (\\S+) (?:by|and) (\\S+)", (ctx, m) -> binary(ctx, m.group(1), m.group(2), "*", (a, b) -> a * b));
        registry.register("math/divide", "divide (\\S+) by (\\S+)", MathCommands::divide);
        registry.register("math/power", "raise (\\S+) to the power of (\\S+)", (ctx, m) -> binary(ctx, m.group(1), m.group(2), "^", Math::pow));
        registry.register("math/sqrt", "calculate (?:the )?square root of (\\S+)", MathCommands::squareRoot);
        registry.register("math/sine", "calculate (?:the )?sine of (\\S+)", (ctx, m) -> trigonometric(ctx, m.group(1), "sin", Math::sin));
        registry.register("math/cosine", "calculate (?:the )?cosine of (\\S+)", (ctx, m) -> trigonometric(ctx, m.group(1), "cos", Math::cos));
        registry.register("math/tangent", "calculate (?:the )?tangent of (\\S+)", (ctx, m) -> trigonometric(ctx, m.group(1), "tan", Math::tan));
        registry.register("math/ln", "calculate (?:the )?natural log(?:arithm)? of (\\S+)", MathCommands::naturalLog);
        registry.register("math/log", "calculate (?:the )?log(?:arithm)? base (\\S+) of (\\S+)", MathCommands::logBase);
        registry.register("math/abs", "calculate (?:the )?absolute value of (\\S+)", MathCommands::absolute);
        registry.register("math/factorial", "calculate (?:the )?factorial of (\\S+)", MathCommands::factorial);
        registry.register("math/round", "round (\\S+) to (\\d+) decimal places?", MathCommands::round);
        registry.register("math/random", "generate (?:a )?random number between (\\S+) and (\\S+)", MathCommands::random);
        registry.register("math/minimum", "find the minimum of (.+)", (ctx, m) -> aggregate(ctx, m.group(1), "Minimum"));
        registry.register("math/maximum", "find the maximum of (.+)", (ctx, m) -> aggregate(ctx, m.group(1), "Maximum"));
        registry.register("math/average", "calculate the average of (.+)", (ctx, m) -> aggregate(ctx, m.group(1), "Average"));
        return registry;
    }

    private static LeafResult binary(CommandContext ctx, String left, String right, String symbol, DoubleBinaryOperator op) {
        var a = Operands.number(ctx.scopes(), left);
        var b = Operands.number(ctx.scopes(), right);
        return store(ctx, op.applyAsDouble(a, b), display(a) + " " + symbol + " " + display(b) + " = ");
    }

    private static LeafResult divide(CommandContext ctx, Matcher m) {
        var a = Operands.number(ctx.scopes(), m.group(1));
        var b = Operands.number(ctx.scopes(), m.group(2));
        if (b == 0) {
            throw new CommandFailedException("Cannot divide by zero");
        }
        return store(ctx, a / b, display(a) + " / " + display(b) + " = ");
    }

    private static LeafResult squareRoot(CommandContext ctx, Matcher m) {
        var a = Operands.number(ctx.scopes(), m.group(1));
        if (a < 0) {
            throw new CommandFailedException("Cannot calculate square root of negative number");
        }
        return store(ctx, Math.sqrt(a), "sqrt(" + display(a) + ") = ");
    }

    /**
     * Angles are in degrees.
     */
    private static LeafResult trigonometric(CommandContext ctx, String raw, String name, DoubleUnaryOperator function) {
        var angle = Operands.number(ctx.scopes(), raw);
        var value = function.applyAsDouble(Math.toRadians(angle));
        return storeFixed(ctx, value, name + "(" + display(angle) + "\u00B0) = ");
    }

    private static LeafResult naturalLog(CommandContext ctx, Matcher m) {
        var a = Operands.number(ctx.scopes(), m.group(1));
        if (a <= 0) {
            throw new CommandFailedException("Cannot calculate logarithm of zero or negative number");
        }
        return storeFixed(ctx, Math.log(a), "ln(" + display(a) + ") = ");
    }

    private static LeafResult logBase(CommandContext ctx, Matcher m) {
        var base = Operands.number(ctx.scopes(), m.group(1));
        var a = Operands.number(ctx.scopes(), m.group(2));
        if (a <= 0 || base <= 0 || base == 1) {
            throw new CommandFailedException("Invalid values for logarithm: base " + display(base) + ", number " + display(a));
        }
        return storeFixed(ctx, Math.log(a) / Math.log(base), "log_" + display(base) + "(" + display(a) + ") = ");
    }

    private static LeafResult absolute(CommandContext ctx, Matcher m) {
        var a = Operands.number(ctx.scopes(), m.group(1));
        return store(ctx, Math.abs(a), "|" + display(a) + "| = ");
    }

    private static LeafResult factorial(CommandContext ctx, Matcher m) {
        var a = Operands.number(ctx.scopes(), m.group(1));
        if (a < 0 || a != Math.rint(a)) {
            throw new CommandFailedException("Factorial needs a non-negative whole number");
        }
        if (a > MAX_FACTORIAL) {
            throw new CommandFailedException("Number too large for factorial calculation");
        }
        var n = (int) a;
        var product = BigInteger.ONE;
        for (int i = 2; i <= n; i++) {
            product = product.multiply(BigInteger.valueOf(i));
        }
        Object value = product.bitLength() < 63 ? (Object) product.longValue() : product.doubleValue();
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, value);
        ctx.println(n + "! = " + product);
        return LeafResult.value(value);
    }

    private static LeafResult round(CommandContext ctx, Matcher m) {
        var a = Operands.number(ctx.scopes(), m.group(1));
        var places = Integer.parseInt(m.group(2));
        var rounded = BigDecimal.valueOf(a).setScale(places, RoundingMode.HALF_EVEN).doubleValue();
        return store(ctx, rounded, display(a) + " rounded to " + places + " decimal places: ");
    }

    private static LeafResult random(CommandContext ctx, Matcher m) {
        var low = (long) Operands.number(ctx.scopes(), m.group(1));
        var high = (long) Operands.number(ctx.scopes(), m.group(2));
        if (high < low) {
            throw new CommandFailedException("Lower bound " + low + " is greater than upper bound " + high);
        }
        long value = ThreadLocalRandom.current().nextLong(low, high + 1);
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, value);
        ctx.println("Random number between " + low + " and " + high + ": " + value);
        return LeafResult.value(value);
    }

    private static LeafResult aggregate(CommandContext ctx, String raw, String label) {
        List<Double> numbers = Operands.numbers(ctx.scopes(), raw);
        double value;
        switch (label) {
            case "Minimum":
                value = numbers.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
                break;
            case "Maximum":
                value = numbers.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
                break;
            default:
                value = numbers.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
                break;
        }
        return store(ctx, value, label + " of " + raw.strip() + ": ");
    }

    private static LeafResult store(CommandContext ctx, double raw, String prefix) {
        var value = Values.normalize(raw);
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, value);
        ctx.println(prefix + Values.format(value));
        return LeafResult.value(value);
    }

    private static LeafResult storeFixed(CommandContext ctx, double raw, String prefix) {
        var value = Values.normalize(raw);
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, value);
        ctx.println(prefix + String.format(Locale.ROOT, "%.6f", raw));
        return LeafResult.value(value);
    }

    private static String display(double value) {
        return Values.format(Values.normalize(value));
    }
}
