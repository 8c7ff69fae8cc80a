package work.vernacular.kernel.shared;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Threshold logger for engine diagnostics. Messages use {@link String#format} placeholders.
 */
public final class KernelLog {
    private final LogLevel threshold;
    private final PrintStream sink;

    public KernelLog(LogLevel threshold, PrintStream sink) {
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public static KernelLog stderr(LogLevel threshold) {
        return new KernelLog(threshold, System.err);
    }

    public LogLevel threshold() {
        return threshold;
    }

    public boolean isEnabled(LogLevel level) {
        return threshold.includes(level);
    }

    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, format, args);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, format, args);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, format, args);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, format, args);
    }

    public void log(LogLevel level, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        var message = args == null || args.length == 0 ? format : String.format(format, args);
        sink.printf("[%s] %s%n", level.name().toLowerCase(), message);
    }
}
