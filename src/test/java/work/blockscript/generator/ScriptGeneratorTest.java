package work.blockscript.generator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.blockscript.block.BlockScript;
import work.blockscript.block.ParseBlockInstance;
import work.blockscript.error.InvalidSettingException;
import work.blockscript.setting.BlockSetting;
import work.blockscript.setting.FixedValue;
import work.blockscript.support.BlockScriptTestSupport;

class ScriptGeneratorTest {
    private final ScriptGenerator generator = new ScriptGenerator();

    @Test
    void generatesFixtureInOrder() {
        var script = BlockScriptTestSupport.decode(BlockScriptTestSupport.readScript("login.loli"));
        var program = generator.generate(script);
        var source = program.source();

        assertTrue(source.startsWith("try {\n    httpRequest(data, \"https://example.com/login\", HttpMethod.GET,"), source);
        assertTrue(source.contains(
            "var csrf = queryCssSelector(data, data.SOURCE, \"input[name=csrf]\", \"value\", \"\", \"\");\n"
                + "var signature = hashString(data, \"\" + csrf + \":secret\", HashFunction.SHA256);\n"
                + "data.markForCapture(\"signature\");\n"
                + "if (checkCondition(data, data.SOURCE, StrComparison.CONTAINS, \"Welcome\")) {\n"), source);
        assertTrue(source.contains("else if (checkCondition(data, data.RESPONSECODE, NumComparison.GREATER_THAN_OR_EQUAL_TO, 400)) {\n"), source);
        assertTrue(source.contains("else {\n    data.setStatus(\"BAN\");\n}\n"), source);
        assertTrue(source.endsWith("globals.put(\"lastSignature\", signature);\n"), source);
        assertFalse(source.contains("unused"), source);

        assertEquals(List.of("csrf", "signature"), program.definedVariables());
        assertEquals(List.of("signature"), program.capturedVariables());
    }

    @Test
    void disabledBlocksContributeNothing() {
        var script = BlockScriptTestSupport.decode("BLOCK:Parse\n  DISABLED\n  MODE:LR\n  => VAR @parsed\n");
        var program = generator.generate(script);
        assertEquals("", program.source());
        assertTrue(program.definedVariables().isEmpty());
    }

    @Test
    void laterBlockDeclaresWhenEarlierOneIsDisabled() {
        var text = "BLOCK:Parse\n  DISABLED\n  MODE:LR\n  => VAR @parsed\n\nBLOCK:Parse\n  MODE:Json\n  => VAR @parsed\n";
        var source = generator.generateSource(BlockScriptTestSupport.decode(text));
        assertEquals("var parsed = queryJsonToken(data, data.SOURCE, \"\", \"\", \"\");\n", source);
    }

    @Test
    void declaresOnceThenAssigns() {
        var first = BlockScriptTestSupport.decode(BlockScriptTestSupport.SCENARIO_A).get(0);
        var second = BlockScriptTestSupport.decode(BlockScriptTestSupport.SCENARIO_A.replace("=> VAR", "=> CAP")).get(0);
        var source = generator.generate(List.of(first, second)).source();
        var call = "parseBetweenStrings(data, \"hello how are you\", \"hello\", \"you\", true, \"\", \"\");\n";
        assertEquals("var parsed = " + call + "parsed = " + call + "data.markForCapture(\"parsed\");\n", source);
    }

    @Test
    void globalOutputsNeverDeclare() {
        var text = "BLOCK:Parse\n  MODE:LR\n  => VAR @globals.token\n\nBLOCK:Parse\n  MODE:LR\n  => CAP @globals.token\n";
        var program = generator.generate(BlockScriptTestSupport.decode(text));
        assertFalse(program.source().contains("var "), program.source());
        assertTrue(program.definedVariables().isEmpty());
        assertEquals(List.of("globals.token"), program.capturedVariables());
    }

    @Test
    void failureAbortsTheWholeScript() {
        ParseBlockInstance broken = BlockScriptTestSupport.newBlock("Parse");
        broken.setSourceLine(12);
        broken.settings().put("bogus", new BlockSetting("bogus", FixedValue.of("x")));
        var script = new BlockScript()
            .add(BlockScriptTestSupport.newBlock("Parse"))
            .add(broken);
        var ex = assertThrows(InvalidSettingException.class, () -> generator.generate(script));
        assertEquals(12, ex.line());
        assertEquals("BLOCK:Parse", ex.excerpt());
    }
}
