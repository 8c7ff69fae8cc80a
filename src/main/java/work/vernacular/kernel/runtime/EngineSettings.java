package work.vernacular.kernel.runtime;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import work.vernacular.kernel.parse.IndentationTokenizer;

/**
 * Tunables for parsing and execution.
 */
public record EngineSettings(int tabWidth, int maxWhileIterations, List<String> commentMarkers, Duration httpTimeout) {
    public static final int DEFAULT_MAX_WHILE_ITERATIONS = 100_000;
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(10);

    public EngineSettings {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be at least 1");
        }
        if (maxWhileIterations < 1) {
            throw new IllegalArgumentException("maxWhileIterations must be positive");
        }
        commentMarkers = List.copyOf(Objects.requireNonNull(commentMarkers, "commentMarkers"));
        Objects.requireNonNull(httpTimeout, "httpTimeout");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
            IndentationTokenizer.DEFAULT_TAB_WIDTH,
            DEFAULT_MAX_WHILE_ITERATIONS,
            IndentationTokenizer.DEFAULT_COMMENT_MARKERS,
            DEFAULT_HTTP_TIMEOUT
        );
    }

    public EngineSettings withMaxWhileIterations(int value) {
        return new EngineSettings(tabWidth, value, commentMarkers, httpTimeout);
    }

    public EngineSettings withTabWidth(int value) {
        return new EngineSettings(value, maxWhileIterations, commentMarkers, httpTimeout);
    }

    public IndentationTokenizer tokenizer() {
        return new IndentationTokenizer(tabWidth, commentMarkers);
    }
}
