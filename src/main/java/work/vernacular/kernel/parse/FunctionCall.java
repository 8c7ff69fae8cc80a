package work.vernacular.kernel.parse;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import work.vernacular.kernel.shared.Values;

/**
 * A recognized function-call command ({@code call function F with a, b} / {@code run F}) with its raw argument texts.
 */
public record FunctionCall(String name, List<String> arguments) {
    private static final int FLAGS = Pattern.CASE_INSENSITIVE;
    private static final List<Pattern> FORMS = List.of(
        Pattern.compile("^call\\s+function\\s+(\\w+)(?:\\s+with\\s+(.+))?$", FLAGS),
        Pattern.compile("^call\\s+(\\w+)\\s+with\\s+(.+)$", FLAGS),
        Pattern.compile("^run\\s+(\\w+)(?:\\s+with\\s+(.+))?$", FLAGS)
    );

    public FunctionCall {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static Optional<FunctionCall> recognize(String text) {
        if (text == null) {
            return Optional.empty();
        }
        var trimmed = text.strip();
        for (var form : FORMS) {
            var m = form.matcher(trimmed);
            if (m.matches()) {
                var rawArgs = m.group(2);
                List<String> args = rawArgs == null || rawArgs.isBlank() ? List.of() : Values.splitList(rawArgs);
                return Optional.of(new FunctionCall(m.group(1), args));
            }
        }
        return Optional.empty();
    }
}
