package work.blockscript.block;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.blockscript.generator.GenerationContext;
import work.blockscript.support.BlockScriptTestSupport;

class ScriptBlockInstanceTest {
    @Test
    void keepsCodeVerbatim() {
        ScriptBlockInstance script = BlockScriptTestSupport.newBlock("LoliCode");
        script.deserialize("int total = 1 + 2;\n\ndata.log(total);\n\n", 1);
        assertEquals(List.of("int total = 1 + 2;", "", "data.log(total);"), script.code());
        assertEquals("int total = 1 + 2;\n\ndata.log(total);\n", script.generate(new GenerationContext()));
        assertEquals("  int total = 1 + 2;\n\n  data.log(total);", script.serialize());
    }

    @Test
    void emptyScriptEmitsNothing() {
        ScriptBlockInstance script = BlockScriptTestSupport.newBlock("LoliCode");
        assertEquals("", script.generate(new GenerationContext()));
        assertEquals("", script.serialize());
    }
}
