package work.vernacular.kernel.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.vernacular.kernel.support.KernelTestSupport.fixture;
import static work.vernacular.kernel.support.KernelTestSupport.parse;
import static work.vernacular.kernel.support.KernelTestSupport.script;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import work.vernacular.kernel.flow.IndentationException;
import work.vernacular.kernel.flow.ScriptSyntaxException;

class BlockTreeBuilderTest {
    @Test
    void nestsBodiesByIndentation() {
        var program = parse(script(
            "set x to 1",
            "repeat 2 times:",
            "    print x",
            "    if x equals 1:",
            "        print \"one\"",
            "print \"done\""
        ));

        assertEquals(3, program.items().size());
        var repeat = assertInstanceOf(BlockNode.class, program.items().get(1));
        assertEquals(BlockKind.REPEAT, repeat.kind());
        assertEquals(2, repeat.body().size());
        var inner = assertInstanceOf(BlockNode.class, repeat.body().get(1));
        assertEquals(BlockKind.IF, inner.kind());
        assertEquals(repeat.lineNumber(), inner.parentLine());
        assertEquals(List.of(new Command("print \"one\"", 5, 8)), inner.body());
        assertEquals(new Command("print \"done\"", 6, 0), program.items().get(2));
    }

    @Test
    void elseAttachesToIfAtSameIndentNotToInnerBlock() {
        var program = parse(script(
            "if a equals 1:",
            "    if b equals 2:",
            "        print \"inner\"",
            "    else:",
            "        print \"inner else\""
        ));

        assertEquals(1, program.items().size());
        var outer = assertInstanceOf(BlockNode.class, program.items().get(0));
        assertEquals(2, outer.body().size());
        assertEquals(BlockKind.IF, ((BlockNode) outer.body().get(0)).kind());
        assertEquals(BlockKind.ELSE, ((BlockNode) outer.body().get(1)).kind());
    }

    @Test
    void elseAfterNestedBodyBelongsToOuterIf() {
        var program = parse(script(
            "if a equals 1:",
            "    if b equals 2:",
            "        print \"inner\"",
            "else:",
            "    print \"outer else\""
        ));

        assertEquals(2, program.items().size());
        assertEquals(BlockKind.IF, ((BlockNode) program.items().get(0)).kind());
        assertEquals(BlockKind.ELSE, ((BlockNode) program.items().get(1)).kind());
    }

    @Test
    void emptyBodiesAreLegal() {
        var program = parse(script(
            "repeat 3 times:",
            "define function noop:",
            "print \"after\"",
            "while x is less than 3:"
        ));

        assertEquals(4, program.items().size());
        assertTrue(((BlockNode) program.items().get(0)).body().isEmpty());
        assertTrue(((BlockNode) program.items().get(3)).body().isEmpty());
    }

    @Test
    void unexpectedIndentIsIndentationError() {
        var error = assertThrows(IndentationException.class, () -> parse(script(
            "print \"a\"",
            "    print \"b\""
        )));
        assertEquals(2, error.lineNumber());
    }

    @Test
    void siblingsMustShareTheFirstChildIndent() {
        var error = assertThrows(IndentationException.class, () -> parse(script(
            "repeat 2 times:",
            "    print \"a\"",
            "        print \"b\""
        )));
        assertEquals(3, error.lineNumber());
    }

    @Test
    void dedentToUnknownLevelIsIndentationError() {
        var error = assertThrows(IndentationException.class, () -> parse(fixture("bad_dedent.vern")));
        assertEquals("indentation_error", error.code());
        assertEquals(3, error.lineNumber());
    }

    @Test
    void elseWithoutIfIsSyntaxError() {
        var error = assertThrows(ScriptSyntaxException.class, () -> parse(fixture("dangling_else.vern")));
        assertEquals(2, error.lineNumber());
    }

    @Test
    void elseAfterNonIfBlockIsSyntaxError() {
        assertThrows(ScriptSyntaxException.class, () -> parse(script(
            "repeat 2 times:",
            "    print \"x\"",
            "else:",
            "    print \"y\""
        )));
    }

    @Test
    void elseIndentMismatchIsSyntaxError() {
        var error = assertThrows(ScriptSyntaxException.class, () -> parse(script(
            "repeat 1 times:",
            "    if x equals 1:",
            "        print \"a\"",
            "      else:",
            "        print \"b\""
        )));
        assertEquals(4, error.lineNumber());
    }

    @Test
    void unknownHeaderIsSyntaxError() {
        var error = assertThrows(ScriptSyntaxException.class, () -> parse(script(
            "print \"a\"",
            "do the thing:",
            "    print \"b\""
        )));
        assertEquals(2, error.lineNumber());
    }

    @ParameterizedTest
    @ValueSource(strings = {"nested_blocks.vern", "single_line.vern"})
    void everySourceLineAppearsExactlyOnce(String name) {
        var source = fixture(name);
        var expected = new IndentationTokenizer().tokenize(source).size();

        assertEquals(expected, parse(source).lineCount());
    }

    @Test
    void flatScriptsHaveNoBlocks() {
        var program = parse(fixture("single_line.vern"));

        assertEquals(10, program.items().size());
        assertTrue(program.items().stream().allMatch(Command.class::isInstance));
    }
}
