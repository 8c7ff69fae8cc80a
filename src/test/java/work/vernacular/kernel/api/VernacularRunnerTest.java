package work.vernacular.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.vernacular.kernel.support.KernelTestSupport;

class VernacularRunnerTest {
    private static RunResult runInline(String source) {
        var config = RunConfiguration.builder()
            .scriptTarget(ScriptTarget.forInline(source))
            .captureOutput(true)
            .build();
        return new VernacularRunner().run(config);
    }

    @Test
    void runsLocalScriptFile() {
        Path script = KernelTestSupport.SCRIPTS.resolve("nested_blocks.vern").toAbsolutePath();
        var config = RunConfiguration.builder()
            .scriptTarget(ScriptTarget.forLocal(script))
            .workingDirectory(script.getParent())
            .captureOutput(true)
            .build();

        var result = new VernacularRunner().run(config);

        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals(0, result.status().exitCode());
        assertNull(result.errorCode());
        assertEquals("ok", result.metadata().get("status"));
        assertEquals(script.toString(), result.metadata().get("script"));
        assertEquals(List.of("describe"), result.metadata().get("functions"));
        assertEquals(
            "first: apple\nnext: banana\nnext: cherry\ntabbed body\ntabbed body\ntotal: 2\n",
            ((String) result.metadata().get("output")).replace("\r\n", "\n")
        );
        var variables = (Map<?, ?>) result.metadata().get("variables");
        assertEquals(2L, variables.get("total"));
        assertEquals(3L, variables.get("position"));
        assertEquals(0L, ((Number) result.metadata().get("commandsFailed")).longValue());
    }

    @Test
    void leafFailuresDoNotFailTheRun() {
        var result = runInline("print ghost\nprint \"still here\"\n");

        assertTrue(result.isSuccess());
        assertEquals(1L, ((Number) result.metadata().get("commandsFailed")).longValue());
        assertEquals(1L, ((Number) result.metadata().get("commandsSucceeded")).longValue());
    }

    @Test
    void structuralErrorsBecomeFailureResults() {
        var result = runInline(KernelTestSupport.fixture("dangling_else.vern"));

        assertFalse(result.isSuccess());
        assertEquals(1, result.status().exitCode());
        assertEquals("syntax_error", result.errorCode());
        var error = (Map<?, ?>) result.metadata().get("error");
        assertEquals(2, error.get("line"));
        assertEquals(0, result.metadata().get("topLevelItems"));
    }

    @Test
    void runtimeErrorsKeepOutputProducedSoFar() {
        var result = runInline(KernelTestSupport.script(
            "define function greet with who:",
            "    print who",
            "print \"before\"",
            "call function greet"
        ));

        assertEquals("arity_error", result.errorCode());
        assertEquals(4, ((Map<?, ?>) result.metadata().get("error")).get("line"));
        assertEquals("before\n", ((String) result.metadata().get("output")).replace("\r\n", "\n"));
        assertEquals("error", result.metadata().get("status"));
    }

    @Test
    void unreadableScriptIsReportedAsUnexpectedError() {
        var config = RunConfiguration.builder()
            .scriptTarget(ScriptTarget.forLocal(Path.of("does", "not", "exist.vern")))
            .build();

        var result = new VernacularRunner().run(config);

        assertEquals("unexpected_error", result.errorCode());
        assertEquals("<inline>", ScriptTarget.forInline("x").display());
    }

    @Test
    void serializesToJson() {
        var json = runInline("set answer to 42\n").toPrettyJson();

        assertTrue(json.contains("\"status\" : \"success\""));
        assertTrue(json.contains("\"answer\" : 42"));
        assertTrue(json.contains("\"finishedAt\""));
    }

    @Test
    void errorCodeIsReadFromTheErrorMetadata() {
        var started = Instant.now();
        var coded = RunResult.failure(Map.<String, Object>of("code", "name_error"), Map.of(), started);
        var uncoded = RunResult.failure(Map.<String, Object>of("message", "boom"), Map.of(), started);

        assertEquals("name_error", coded.errorCode());
        assertNull(uncoded.errorCode());
    }
}
