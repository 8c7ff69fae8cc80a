package work.vernacular.kernel.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.vernacular.kernel.runtime.EngineSettings;

/**
 * Reads engine settings from a TOML file:
 *
 * <pre>
 * [engine]
 * tab_width = 4
 * max_while_iterations = 100000
 * comment_markers = ["#", "//"]
 *
 * [http]
 * timeout_seconds = 10
 * </pre>
 *
 * Missing keys keep their defaults.
 */
public final class SettingsLoader {
    private SettingsLoader() {}

    public static EngineSettings load(Path path) {
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), EngineSettings.defaults());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    public static EngineSettings parse(String toml, EngineSettings base) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings TOML: " + errors);
        }
        int tabWidth = intValue(result, "engine.tab_width", base.tabWidth());
        int maxWhile = intValue(result, "engine.max_while_iterations", base.maxWhileIterations());
        var markers = base.commentMarkers();
        if (result.contains("engine.comment_markers")) {
            if (!result.isArray("engine.comment_markers")) {
                throw new IllegalArgumentException("engine.comment_markers must be an array of strings");
            }
            var array = result.getArray("engine.comment_markers");
            var parsed = new ArrayList<String>(array.size());
            for (int i = 0; i < array.size(); i++) {
                if (!(array.get(i) instanceof String marker) || marker.isBlank()) {
                    throw new IllegalArgumentException("engine.comment_markers must contain non-blank strings");
                }
                parsed.add(marker);
            }
            markers = parsed;
        }
        var timeout = base.httpTimeout();
        if (result.contains("http.timeout_seconds")) {
            int seconds = intValue(result, "http.timeout_seconds", 0);
            if (seconds < 1) {
                throw new IllegalArgumentException("http.timeout_seconds must be positive");
            }
            timeout = Duration.ofSeconds(seconds);
        }
        try {
            return new EngineSettings(tabWidth, maxWhile, markers, timeout);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid settings: " + ex.getMessage(), ex);
        }
    }

    private static int intValue(TomlParseResult result, String key, int fallback) {
        if (!result.contains(key)) {
            return fallback;
        }
        if (!result.isLong(key)) {
            throw new IllegalArgumentException(key + " must be an integer");
        }
        long value = result.getLong(key);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " is out of range");
        }
        return (int) value;
    }
}
