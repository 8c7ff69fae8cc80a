package work.vernacular.kernel.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered pattern-to-handler table. The first pattern matching the whole command wins, so more specific
 * patterns are registered before general ones.
 */
public final class CommandRegistry {
    private final List<Entry> entries = new ArrayList<>();

    public CommandRegistry register(String name, String regex, LeafHandler handler) {
        entries.add(new Entry(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), handler));
        return this;
    }

    public Optional<Match> find(String text) {
        if (text == null) {
            return Optional.empty();
        }
        var trimmed = text.strip();
        for (var entry : entries) {
            var matcher = entry.pattern().matcher(trimmed);
            if (matcher.matches()) {
                return Optional.of(new Match(entry, matcher));
            }
        }
        return Optional.empty();
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public record Entry(String name, Pattern pattern, LeafHandler handler) {}

    public record Match(Entry entry, Matcher matcher) {}
}
