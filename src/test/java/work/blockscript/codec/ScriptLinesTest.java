package work.blockscript.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScriptLinesTest {
    @Test
    void numbersAndTrimsLines() {
        var lines = ScriptLines.split("  BLOCK:Parse \r\n\tMODE:LR\n", 5);
        assertEquals(List.of(new SourceLine(5, "BLOCK:Parse"), new SourceLine(6, "MODE:LR")), lines);
    }

    @Test
    void keepsInteriorBlankLines() {
        var lines = ScriptLines.split("a\n\nb");
        assertEquals(3, lines.size());
        assertTrue(lines.get(1).isBlank());
        assertEquals(3, lines.get(2).number());
    }

    @Test
    void emptyTextHasNoLines() {
        assertTrue(ScriptLines.split("").isEmpty());
        assertTrue(ScriptLines.split(null).isEmpty());
    }
}
