package work.vernacular.kernel.shared;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Literal parsing, number normalization and display formatting shared by the engine and the built-in commands.
 * Integral numbers are carried as {@link Long}, everything else as {@link Double}.
 */
public final class Values {
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+|-?\\d*\\.\\d+");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

    private Values() {}

    public static boolean isQuoted(String raw) {
        if (raw == null) {
            return false;
        }
        var s = raw.strip();
        if (s.length() < 2) {
            return false;
        }
        char first = s.charAt(0);
        return (first == '"' || first == '\'') && s.charAt(s.length() - 1) == first;
    }

    public static String unquote(String raw) {
        var s = raw == null ? "" : raw.strip();
        return isQuoted(s) ? s.substring(1, s.length() - 1) : s;
    }

    public static boolean isIdentifier(String raw) {
        return raw != null && IDENTIFIER.matcher(raw.strip()).matches();
    }

    public static boolean isNumeric(String raw) {
        if (raw == null) {
            return false;
        }
        var s = raw.strip();
        return INTEGER.matcher(s).matches() || DECIMAL.matcher(s).matches();
    }

    /**
     * Parses a literal: quoted text, integer, decimal or boolean. Anything else is returned as stripped text.
     */
    public static Object parseLiteral(String raw) {
        if (raw == null) {
            return "";
        }
        var s = raw.strip();
        if (isQuoted(s)) {
            return unquote(s);
        }
        if (INTEGER.matcher(s).matches()) {
            try {
                return Long.parseLong(s);
            } catch (NumberFormatException ex) {
                return Double.parseDouble(s);
            }
        }
        if (DECIMAL.matcher(s).matches()) {
            return Double.parseDouble(s);
        }
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            return Boolean.parseBoolean(s.toLowerCase(Locale.ROOT));
        }
        return s;
    }

    public static Optional<Double> asNumber(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.doubleValue());
        }
        if (value instanceof String text && isNumeric(text)) {
            return Optional.of(Double.parseDouble(text.strip()));
        }
        return Optional.empty();
    }

    public static Object normalize(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 9.0e15) {
            return (long) value;
        }
        return value;
    }

    /**
     * Converts values coming from JSON/YAML readers to the engine's number representation.
     */
    public static Object normalizeLoaded(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(normalizeLoaded(item));
            }
            return copy;
        }
        return value;
    }

    public static boolean looselyEquals(Object left, Object right) {
        var l = asNumber(left);
        var r = asNumber(right);
        if (l.isPresent() && r.isPresent()) {
            return Double.compare(l.get(), r.get()) == 0;
        }
        return format(left).equals(format(right));
    }

    public static String format(Object value) {
        if (value == null) {
            return "none";
        }
        if (value instanceof Double d) {
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 9.0e15) {
                return Long.toString(d.longValue());
            }
            return d.toString();
        }
        if (value instanceof List<?> list) {
            var joiner = new StringJoiner(", ", "[", "]");
            for (var item : list) {
                joiner.add(item instanceof String s ? "'" + s + "'" : format(item));
            }
            return joiner.toString();
        }
        if (value instanceof Map<?, ?> map) {
            var joiner = new StringJoiner(", ", "{", "}");
            for (var entry : map.entrySet()) {
                joiner.add(entry.getKey() + ": " + format(entry.getValue()));
            }
            return joiner.toString();
        }
        return value.toString();
    }

    public static String typeName(Object value) {
        if (value instanceof Long || value instanceof Integer) {
            return "integer";
        }
        if (value instanceof Double || value instanceof Float) {
            return "float";
        }
        if (value instanceof Boolean) {
            return "boolean";
        }
        if (value instanceof List<?>) {
            return "list";
        }
        if (value instanceof Map<?, ?>) {
            return "map";
        }
        return value == null ? "none" : "string";
    }

    /**
     * Splits a comma separated list, ignoring commas inside quotes. Items are stripped but keep their quotes.
     */
    public static List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyList();
        }
        var items = new ArrayList<String>();
        var current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (quote != 0) {
                if (ch == quote) {
                    quote = 0;
                }
                current.append(ch);
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
                current.append(ch);
            } else if (ch == ',') {
                items.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        items.add(current.toString().strip());
        return items;
    }
}
