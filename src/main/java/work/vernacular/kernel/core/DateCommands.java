package work.vernacular.kernel.core;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import work.vernacular.kernel.runtime.CommandContext;
import work.vernacular.kernel.runtime.ExecutionEngine;
import work.vernacular.kernel.runtime.LeafResult;

/**
 * Current date and time, and day offsets from today. Values are printed and stored in {@code result} as text.
 */
public final class DateCommands {
    static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE;
    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private DateCommands() {}

    public static CommandRegistry register(CommandRegistry registry) {
        return register(registry, Clock.systemDefaultZone());
    }

    public static CommandRegistry register(CommandRegistry registry, Clock clock) {
        Objects.requireNonNull(clock, "clock");
        registry.register("date/datetime", "get (?:the )?current datetime",
            (ctx, m) -> store(ctx, "Current datetime: ", LocalDateTime.now(clock).format(DATE_TIME)));
        registry.register("date/time", "get (?:the )?current time",
            (ctx, m) -> store(ctx, "Current time: ", LocalDateTime.now(clock).format(TIME)));
        registry.register("date/date", "get (?:the )?current date",
            (ctx, m) -> store(ctx, "Current date: ", LocalDate.now(clock).format(DATE)));
        registry.register("date/plus-days", "add (\\d+) days? to today", (ctx, m) -> {
            long days = Long.parseLong(m.group(1));
            return store(ctx, "Date " + days + " days from today: ", LocalDate.now(clock).plusDays(days).format(DATE));
        });
        registry.register("date/minus-days", "subtract (\\d+) days? from today", (ctx, m) -> {
            long days = Long.parseLong(m.group(1));
            return store(ctx, "Date " + days + " days ago: ", LocalDate.now(clock).minusDays(days).format(DATE));
        });
        return registry;
    }

    private static LeafResult store(CommandContext ctx, String label, String value) {
        ctx.scopes().assign(ExecutionEngine.RESULT_VARIABLE, value);
        ctx.println(label + value);
        return LeafResult.value(value);
    }
}
