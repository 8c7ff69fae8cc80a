package work.vernacular.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.vernacular.kernel.runtime.EngineSettings;
import work.vernacular.kernel.support.KernelTestSupport;

class SettingsLoaderTest {
    @Test
    void loadsEveryKeyFromFile() {
        var settings = SettingsLoader.load(KernelTestSupport.SCRIPTS.resolve("settings.toml"));

        assertEquals(2, settings.tabWidth());
        assertEquals(25, settings.maxWhileIterations());
        assertEquals(List.of("#", "--"), settings.commentMarkers());
        assertEquals(Duration.ofSeconds(3), settings.httpTimeout());
    }

    @Test
    void missingKeysKeepBaseValues() {
        var base = EngineSettings.defaults();
        var settings = SettingsLoader.parse("[engine]\nmax_while_iterations = 7\n", base);

        assertEquals(7, settings.maxWhileIterations());
        assertEquals(base.tabWidth(), settings.tabWidth());
        assertEquals(base.commentMarkers(), settings.commentMarkers());
        assertEquals(base.httpTimeout(), settings.httpTimeout());
    }

    @Test
    void invalidValuesNameTheKey() {
        var base = EngineSettings.defaults();

        var wrongType = assertThrows(IllegalArgumentException.class,
            () -> SettingsLoader.parse("[engine]\ntab_width = \"wide\"\n", base));
        assertTrue(wrongType.getMessage().contains("engine.tab_width"));

        var timeout = assertThrows(IllegalArgumentException.class,
            () -> SettingsLoader.parse("[http]\ntimeout_seconds = 0\n", base));
        assertTrue(timeout.getMessage().contains("http.timeout_seconds"));

        var markers = assertThrows(IllegalArgumentException.class,
            () -> SettingsLoader.parse("[engine]\ncomment_markers = [\"#\", \" \"]\n", base));
        assertTrue(markers.getMessage().contains("engine.comment_markers"));

        assertThrows(IllegalArgumentException.class, () -> SettingsLoader.parse("[engine]\ntab_width = 0\n", base));
        assertThrows(IllegalArgumentException.class, () -> SettingsLoader.parse("[engine\n", base));
    }

    @Test
    void customMarkersAndTabWidthShapeParsing() {
        var settings = SettingsLoader.load(KernelTestSupport.SCRIPTS.resolve("settings.toml"));
        var h = KernelTestSupport.harness(settings).run(
            "-- custom comment\nrepeat 2 times:\n\tprint \"tab\"\n  print \"spaces\"\n"
        );

        assertEquals(List.of("tab", "spaces", "tab", "spaces"), h.lines());
    }
}
