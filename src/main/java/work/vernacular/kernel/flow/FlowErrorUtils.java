package work.vernacular.kernel.flow;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts failures into the {@code code/message/line} shape reported by run results.
 */
public final class FlowErrorUtils {
    private FlowErrorUtils() {}

    public static Map<String, Object> normalize(Throwable error) {
        if (error instanceof ScriptErrorException se) {
            return toMap(se.code(), se.detail(), se.lineNumber());
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error", 0);
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        return toMap("unexpected_error", message, 0);
    }

    private static Map<String, Object> toMap(String code, String message, int line) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        if (line > 0) {
            map.put("line", line);
        }
        return map;
    }
}
