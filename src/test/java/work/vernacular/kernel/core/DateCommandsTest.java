package work.vernacular.kernel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.vernacular.kernel.support.KernelTestSupport.harness;
import static work.vernacular.kernel.support.KernelTestSupport.script;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.vernacular.kernel.runtime.EngineSettings;

class DateCommandsTest {
    private static final Clock NEW_YEARS_EVE = Clock.fixed(Instant.parse("2024-12-31T22:15:09Z"), ZoneOffset.UTC);

    private static BuiltinCommandExecutor executor(Clock clock) {
        var registry = new CommandRegistry();
        DateCommands.register(registry, clock);
        VariableCommands.register(registry);
        OutputCommands.register(registry);
        return new BuiltinCommandExecutor(registry, new ConditionEvaluator());
    }

    @Test
    void currentDateAndTimeUseTheClock() {
        var h = harness(EngineSettings.defaults(), null, executor(NEW_YEARS_EVE)).run(script(
            "get the current datetime",
            "get current time",
            "get the current date",
            "print result"
        ));

        assertEquals(List.of(
            "Current datetime: 2024-12-31 22:15:09",
            "Current time: 22:15:09",
            "Current date: 2024-12-31",
            "2024-12-31"
        ), h.lines());
    }

    @Test
    void dayOffsetsCrossMonthAndYearBoundaries() {
        var h = harness(EngineSettings.defaults(), null, executor(NEW_YEARS_EVE)).run(script(
            "add 1 day to today",
            "set tomorrow to result",
            "subtract 31 days from today"
        ));

        assertEquals(List.of(
            "Date 1 days from today: 2025-01-01",
            "Date 31 days ago: 2024-11-30"
        ), h.lines());
        assertEquals("2025-01-01", h.variable("tomorrow"));
        assertEquals("2024-11-30", h.variable("result"));
    }

    @Test
    void builtinTableUsesTheSystemClock() {
        var before = LocalDate.now();
        var h = harness().run("get the current date\n");
        var after = LocalDate.now();

        var reported = LocalDate.parse((String) h.variable("result"));
        assertTrue(!reported.isBefore(before) && !reported.isAfter(after));
    }
}
