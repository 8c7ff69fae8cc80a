package work.vernacular.kernel.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.vernacular.kernel.support.KernelTestSupport.fixture;
import static work.vernacular.kernel.support.KernelTestSupport.parse;
import static work.vernacular.kernel.support.KernelTestSupport.script;

import org.junit.jupiter.api.Test;

class ProgramPrinterTest {
    @Test
    void reparsingPrintedProgramYieldsSameShape() {
        var original = parse(fixture("nested_blocks.vern"));

        for (int width : new int[] {1, 2, 4, 8}) {
            var reparsed = parse(ProgramPrinter.print(original, width));
            assertEquals(ProgramPrinter.shape(original), ProgramPrinter.shape(reparsed));
            assertEquals(original.lineCount(), reparsed.lineCount());
        }
    }

    @Test
    void printingIsIdempotent() {
        var once = ProgramPrinter.print(parse(fixture("nested_blocks.vern")), 4);
        var twice = ProgramPrinter.print(parse(once), 4);

        assertEquals(once, twice);
    }

    @Test
    void normalizesMixedIndentation() {
        var program = parse("if x equals 1:\n\tprint \"tab\"\nelse:\n  print \"two\"\n");

        assertEquals(
            script("if x equals 1:", "  print \"tab\"", "else:", "  print \"two\""),
            ProgramPrinter.print(program, 2)
        );
    }

    @Test
    void shapeIgnoresWhitespace() {
        var a = parse("repeat 2 times:\n    print \"x\"\n");
        var b = parse("repeat 2 times:\n\t\tprint \"x\"\n");

        assertEquals(ProgramPrinter.shape(a), ProgramPrinter.shape(b));
    }

    @Test
    void rejectsNonPositiveWidth() {
        assertThrows(IllegalArgumentException.class, () -> ProgramPrinter.print(parse("print 1\n"), 0));
    }
}
