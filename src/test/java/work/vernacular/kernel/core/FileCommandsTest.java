package work.vernacular.kernel.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.vernacular.kernel.support.KernelTestSupport.harness;
import static work.vernacular.kernel.support.KernelTestSupport.script;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCommandsTest {
    @TempDir
    Path workDir;

    @Test
    void textFilesRoundTripThroughTheWorkingDirectory() throws Exception {
        var h = harness(workDir).run(script(
            "save \"first line\" to notes.txt",
            "check if file notes.txt exists",
            "read notes.txt",
            "copy file notes.txt to backup/notes.txt",
            "delete file notes.txt",
            "does file notes.txt exist"
        ));

        assertEquals(List.of(
            "File 'notes.txt' exists",
            "first line",
            "File 'notes.txt' does not exist"
        ), h.lines());
        assertEquals(false, h.variable("result"));
        assertEquals("first line", Files.readString(workDir.resolve("backup/notes.txt")));
        assertFalse(Files.exists(workDir.resolve("notes.txt")));
    }

    @Test
    void missingFilesAreLeafFailures() {
        var h = harness(workDir).run(script(
            "read absent.txt",
            "delete file absent.txt",
            "print \"continued\""
        ));

        assertEquals(List.of("continued"), h.lines());
        assertEquals(2, h.engine().stats().commandsFailed());
    }

    @Test
    void listsSaveAndLoadAsJson() throws Exception {
        var h = harness(workDir).run(script(
            "create list inventory with \"bolt\", 4, 2.5",
            "save list inventory to data/inventory.json",
            "load list restored from data/inventory.json"
        ));

        assertEquals(List.of("bolt", 4L, 2.5), h.variable("restored"));
        assertTrue(Files.readString(workDir.resolve("data/inventory.json")).contains("\"bolt\""));
    }

    @Test
    void csvFilesUseHeadersForRows() throws Exception {
        var h = harness(workDir).run(script(
            "set city to \"Oslo\"",
            "create CSV file people.csv with headers name, age, city",
            "add row \"Ann\", 31, city to CSV people.csv",
            "add row \"Bo, Jr.\", 7, \"Rome\" to CSV people.csv",
            "read CSV file people.csv"
        ));

        @SuppressWarnings("unchecked")
        var rows = (List<Map<String, Object>>) h.variable("rows");
        assertEquals(2, rows.size());
        assertEquals("Ann", rows.get(0).get("name"));
        assertEquals(31L, rows.get(0).get("age"));
        assertEquals("Oslo", rows.get(0).get("city"));
        assertEquals("Bo, Jr.", rows.get(1).get("name"));
        assertEquals(2, h.lines().size());
        assertTrue(Files.readString(workDir.resolve("people.csv")).startsWith("name,age,city"));
    }

    @Test
    void variablesSaveAndLoadAsYaml() {
        var writer = harness(workDir).run(script(
            "set title to \"Report\"",
            "set pages to 12",
            "create list tags with \"a\", \"b\"",
            "save variables to state.yaml"
        ));
        assertEquals(0, writer.engine().stats().commandsFailed());

        var reader = harness(workDir).run("load variables from state.yaml\n");

        assertEquals("Report", reader.variable("title"));
        assertEquals(12L, reader.variable("pages"));
        assertEquals(List.of("a", "b"), reader.variable("tags"));
    }

    @Test
    void variablesAndListsSaveAndLoadAsXml() throws Exception {
        var writer = harness(workDir).run(script(
            "set title to \"Report\"",
            "set pages to 12",
            "set ratio to 2.5",
            "set done to true",
            "create list tags with \"a\", 2",
            "save data to export/state.xml"
        ));
        assertEquals(0, writer.engine().stats().commandsFailed());
        var xml = Files.readString(workDir.resolve("export/state.xml"));
        assertTrue(xml.contains("<vernacular_data>"));
        assertTrue(xml.contains("name=\"pages\" type=\"integer\""));

        var reader = harness(workDir).run("load data from export/state.xml\n");

        assertEquals("Report", reader.variable("title"));
        assertEquals(12L, reader.variable("pages"));
        assertEquals(2.5, reader.variable("ratio"));
        assertEquals(true, reader.variable("done"));
        assertEquals(List.of("a", 2L), reader.variable("tags"));
    }

    @Test
    void xmlTypeAliasesLoadAndBadNumbersFail() throws Exception {
        Files.writeString(workDir.resolve("legacy.xml"), String.join("\n",
            "<vernacular_data>",
            "  <variables>",
            "    <variable name=\"count\" type=\"int\">7</variable>",
            "    <variable name=\"ok\" type=\"bool\">True</variable>",
            "    <variable name=\"label\" type=\"str\">7</variable>",
            "  </variables>",
            "</vernacular_data>"));
        Files.writeString(workDir.resolve("broken.xml"),
            "<vernacular_data><variables><variable name=\"n\" type=\"integer\">seven</variable></variables></vernacular_data>");

        var h = harness(workDir).run(script(
            "load variables from legacy.xml",
            "load variables from broken.xml"
        ));

        assertEquals(7L, h.variable("count"));
        assertEquals(true, h.variable("ok"));
        assertEquals("7", h.variable("label"));
        assertFalse(h.isDefined("n"));
        assertEquals(1, h.engine().stats().commandsFailed());
    }
}
