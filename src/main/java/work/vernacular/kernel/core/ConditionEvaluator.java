package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.vernacular.kernel.flow.EvaluationException;
import work.vernacular.kernel.flow.NameResolutionException;
import work.vernacular.kernel.runtime.ScopeStack;
import work.vernacular.kernel.shared.Values;

/**
 * Natural-language predicates used by {@code if} and {@code while} headers.
 *
 * <p>Grammar: {@code or} binds loosest, then {@code and}, then a leading {@code not}. Atoms are comparisons
 * ({@code is greater than}, {@code is at most}, {@code equals}, {@code contains}, ...), emptiness checks,
 * {@code list L has N items}, or the literals {@code true}/{@code false}. Operands are quoted text, numbers or
 * variable names; an unknown variable is a {@link NameResolutionException}.</p>
 */
public final class ConditionEvaluator {
    private static final Pattern GREATER_OR_EQUAL = Pattern.compile("\\bis greater than or equal to\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LESS_OR_EQUAL = Pattern.compile("\\bis less than or equal to\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern LIST_HAS = compile("list (\\w+) has (\\S+) items?");
    private static final Pattern LIST_EMPTY = compile("list (\\w+) is empty");
    private static final Pattern NOT_EMPTY = compile("(.+?) is not empty");
    private static final Pattern EMPTY = compile("(.+?) is empty");
    private static final Pattern NOT_EQUAL = compile("(.+?) (?:is not equal to|does not equal) (.+)");
    private static final Pattern GREATER = compile("(.+?) is greater than (.+)");
    private static final Pattern LESS = compile("(.+?) is less than (.+)");
    private static final Pattern AT_LEAST = compile("(.+?) is at least (.+)");
    private static final Pattern AT_MOST = compile("(.+?) is at most (.+)");
    private static final Pattern EQUAL = compile("(.+?) (?:is equal to|equals|equal to) (.+)");
    private static final Pattern CONTAINS = compile("(.+?) (?:contains|includes) (.+)");

    public boolean evaluate(String condition, ScopeStack scopes) {
        if (condition == null || condition.isBlank()) {
            throw new EvaluationException("empty condition");
        }
        var text = GREATER_OR_EQUAL.matcher(condition.strip()).replaceAll("is at least");
        text = LESS_OR_EQUAL.matcher(text).replaceAll("is at most");
        return disjunction(text, scopes);
    }

    private boolean disjunction(String text, ScopeStack scopes) {
        for (var part : splitKeyword(text, "or")) {
            if (conjunction(part, scopes)) {
                return true;
            }
        }
        return false;
    }

    private boolean conjunction(String text, ScopeStack scopes) {
        for (var part : splitKeyword(text, "and")) {
            if (!unary(part, scopes)) {
                return false;
            }
        }
        return true;
    }

    private boolean unary(String text, ScopeStack scopes) {
        var s = text.strip();
        if (s.isEmpty()) {
            throw new EvaluationException("missing operand in condition");
        }
        if (s.regionMatches(true, 0, "not ", 0, 4)) {
            return !unary(s.substring(4), scopes);
        }
        if ("true".equalsIgnoreCase(s)) {
            return true;
        }
        if ("false".equalsIgnoreCase(s)) {
            return false;
        }
        return atom(s, scopes);
    }

    private boolean atom(String s, ScopeStack scopes) {
        Matcher m;
        if ((m = LIST_HAS.matcher(s)).matches()) {
            var list = list(scopes, m.group(1));
            var expected = Values.asNumber(Values.parseLiteral(m.group(2)))
                .orElseThrow(() -> new EvaluationException("item count must be a number in '" + s + "'"));
            return list.size() == expected;
        }
        if ((m = LIST_EMPTY.matcher(s)).matches()) {
            return list(scopes, m.group(1)).isEmpty();
        }
        if ((m = NOT_EMPTY.matcher(s)).matches()) {
            return !isEmpty(operand(m.group(1), scopes));
        }
        if ((m = EMPTY.matcher(s)).matches()) {
            return isEmpty(operand(m.group(1), scopes));
        }
        if ((m = NOT_EQUAL.matcher(s)).matches()) {
            return !Values.looselyEquals(operand(m.group(1), scopes), operand(m.group(2), scopes));
        }
        if ((m = GREATER.matcher(s)).matches()) {
            return compare(m, scopes) > 0;
        }
        if ((m = LESS.matcher(s)).matches()) {
            return compare(m, scopes) < 0;
        }
        if ((m = AT_LEAST.matcher(s)).matches()) {
            return compare(m, scopes) >= 0;
        }
        if ((m = AT_MOST.matcher(s)).matches()) {
            return compare(m, scopes) <= 0;
        }
        if ((m = EQUAL.matcher(s)).matches()) {
            return Values.looselyEquals(operand(m.group(1), scopes), operand(m.group(2), scopes));
        }
        if ((m = CONTAINS.matcher(s)).matches()) {
            return contains(operand(m.group(1), scopes), operand(m.group(2), scopes));
        }
        var single = s.strip();
        if (Values.isIdentifier(single)) {
            return truthy(operand(single, scopes));
        }
        throw new EvaluationException("cannot evaluate condition '" + s + "'");
    }

    private int compare(Matcher m, ScopeStack scopes) {
        var left = number(m.group(1), scopes);
        var right = number(m.group(2), scopes);
        return Double.compare(left, right);
    }

    private double number(String raw, ScopeStack scopes) {
        var value = operand(raw, scopes);
        return Values.asNumber(value)
            .orElseThrow(() -> new EvaluationException("'" + raw.strip() + "' is not a number (" + Values.format(value) + ")"));
    }

    private Object operand(String raw, ScopeStack scopes) {
        var s = raw.strip();
        if (Values.isQuoted(s) || Values.isNumeric(s)) {
            return Values.parseLiteral(s);
        }
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            return Boolean.parseBoolean(s.toLowerCase(Locale.ROOT));
        }
        if (Values.isIdentifier(s)) {
            return scopes.resolve(s);
        }
        throw new EvaluationException("cannot evaluate operand '" + s + "'");
    }

    private static List<Object> list(ScopeStack scopes, String name) {
        var value = scopes.resolve(name);
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        throw new EvaluationException("'" + name + "' is not a list");
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof List<?> list) {
            for (var element : list) {
                if (Values.looselyEquals(element, item)) {
                    return true;
                }
            }
            return false;
        }
        return Values.format(container).contains(Values.format(item));
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof List<?> list) {
            return list.isEmpty();
        }
        if (value instanceof String text) {
            return text.isEmpty();
        }
        return false;
    }

    private static boolean truthy(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0;
        }
        return !isEmpty(value);
    }

    /**
     * Splits on a whole-word keyword outside quotes, e.g. {@code " and "}.
     */
    static List<String> splitKeyword(String text, String keyword) {
        var needle = " " + keyword + " ";
        var parts = new ArrayList<String>();
        char quote = 0;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (text.regionMatches(true, i, needle, 0, needle.length())) {
                parts.add(text.substring(start, i));
                i += needle.length();
                start = i;
                continue;
            }
            i++;
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
