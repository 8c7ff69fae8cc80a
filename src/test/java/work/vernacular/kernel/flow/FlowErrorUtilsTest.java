package work.vernacular.kernel.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;

class FlowErrorUtilsTest {
    @Test
    void scriptErrorsKeepCodeAndLine() {
        var error = FlowErrorUtils.normalize(new ScriptSyntaxException("else: without a matching if", 4));

        assertEquals("syntax_error", error.get("code"));
        assertEquals("else: without a matching if", error.get("message"));
        assertEquals(4, error.get("line"));
    }

    @Test
    void innermostLineWins() {
        var ex = new IndentationException("unexpected indent", 7).atLine(2);

        assertEquals(7, ex.lineNumber());
        assertEquals("line 7: unexpected indent", ex.getMessage());
        assertEquals(9, new EvaluationException("bad").atLine(9).lineNumber());
    }

    @Test
    void otherFailuresAreUnexpected() {
        var error = FlowErrorUtils.normalize(new IllegalStateException());

        assertEquals("unexpected_error", error.get("code"));
        assertEquals("IllegalStateException", error.get("message"));
        assertFalse(error.containsKey("line"));
    }
}
