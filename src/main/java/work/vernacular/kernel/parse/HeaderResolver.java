package work.vernacular.kernel.parse;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.vernacular.kernel.flow.ScriptSyntaxException;

/**
 * Classifies header text into a {@link BlockHeader}. Patterns are tried most specific first so an ambiguous
 * header always resolves the same way.
 */
public final class HeaderResolver {
    public static final String OPENING_MARKER = ":";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;
    private static final Pattern ELSE = Pattern.compile("^else\\s*:$", FLAGS);
    private static final Pattern IF = Pattern.compile("^if\\s+(.+?)\\s*:$", FLAGS);
    private static final Pattern WHILE = Pattern.compile("^while\\s+(.+?)\\s*:$", FLAGS);
    private static final Pattern FOR_EACH = Pattern.compile("^for\\s+each\\s+(\\w+)\\s+in\\s+list\\s+(\\w+)\\s*:$", FLAGS);
    private static final Pattern REPEAT = Pattern.compile("^repeat\\s+(\\d+)\\s+times?\\s*:$", FLAGS);
    private static final Pattern FUNCTION_WITH_PARAMS = Pattern.compile("^define\\s+function\\s+(\\w+)\\s+with\\s+(.+?)\\s*:$", FLAGS);
    private static final Pattern FUNCTION = Pattern.compile("^define\\s+function\\s+(\\w+)\\s*:$", FLAGS);
    private static final Pattern PARAMETER = Pattern.compile("\\w+");

    private HeaderResolver() {}

    /**
     * True when the line ends with the block-opening marker and therefore must resolve to a header.
     */
    public static boolean isHeaderLine(String text) {
        return text != null && text.strip().endsWith(OPENING_MARKER);
    }

    public static boolean isElse(String text) {
        return text != null && ELSE.matcher(text.strip()).matches();
    }

    public static Optional<BlockHeader> resolve(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(match(text.strip(), 0));
    }

    public static BlockHeader resolveOrThrow(String text, int lineNumber) {
        var header = match(text == null ? "" : text.strip(), lineNumber);
        if (header == null) {
            throw new ScriptSyntaxException("unrecognized block header '" + text + "'", lineNumber);
        }
        return header;
    }

    private static BlockHeader match(String text, int lineNumber) {
        if (ELSE.matcher(text).matches()) {
            return new BlockHeader.Else();
        }
        Matcher m = IF.matcher(text);
        if (m.matches()) {
            return new BlockHeader.If(m.group(1));
        }
        m = WHILE.matcher(text);
        if (m.matches()) {
            return new BlockHeader.While(m.group(1));
        }
        m = FOR_EACH.matcher(text);
        if (m.matches()) {
            return new BlockHeader.ForEach(m.group(1), m.group(2));
        }
        m = REPEAT.matcher(text);
        if (m.matches()) {
            try {
                return new BlockHeader.Repeat(Integer.parseInt(m.group(1)));
            } catch (NumberFormatException ex) {
                throw new ScriptSyntaxException("repeat count is too large: " + m.group(1), lineNumber);
            }
        }
        m = FUNCTION_WITH_PARAMS.matcher(text);
        if (m.matches()) {
            return new BlockHeader.FunctionDef(m.group(1), parameters(m.group(2), lineNumber));
        }
        m = FUNCTION.matcher(text);
        if (m.matches()) {
            return new BlockHeader.FunctionDef(m.group(1), List.of());
        }
        return null;
    }

    private static List<String> parameters(String raw, int lineNumber) {
        var seen = new LinkedHashSet<String>();
        for (var part : raw.split(",")) {
            var name = part.strip();
            if (!PARAMETER.matcher(name).matches()) {
                throw new ScriptSyntaxException("invalid parameter name '" + name + "'", lineNumber);
            }
            if (!seen.add(name)) {
                throw new ScriptSyntaxException("duplicate parameter name '" + name + "'", lineNumber);
            }
        }
        return new ArrayList<>(seen);
    }
}
