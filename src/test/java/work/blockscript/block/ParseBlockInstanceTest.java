package work.blockscript.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.blockscript.error.InvalidSettingException;
import work.blockscript.error.ScriptParseException;
import work.blockscript.generator.GenerationContext;
import work.blockscript.setting.BlockSetting;
import work.blockscript.setting.FixedValue;
import work.blockscript.support.BlockScriptTestSupport;

class ParseBlockInstanceTest {
    @Test
    void decodesDelimiterParse() {
        var script = BlockScriptTestSupport.decode(BlockScriptTestSupport.SCENARIO_A);
        assertEquals(1, script.size());
        var parse = (ParseBlockInstance) script.get(0);
        assertEquals(ParseMode.LR, parse.mode());
        assertEquals("parsed", parse.outputVariable());
        assertFalse(parse.isCapture());
        assertFalse(parse.isRecursive());
        assertEquals(FixedValue.of("hello how are you"), parse.setting("input"));
        assertEquals(1, parse.sourceLine());
    }

    @Test
    void generatesDeclarationForNewVariable() {
        var parse = BlockScriptTestSupport.decode(BlockScriptTestSupport.SCENARIO_A).get(0);
        var context = new GenerationContext();
        assertEquals(
            "var parsed = parseBetweenStrings(data, \"hello how are you\", \"hello\", \"you\", true, \"\", \"\");\n",
            parse.generate(context));
        assertTrue(context.definedVariables().contains("parsed"));
    }

    @Test
    void secondAssignmentReusesDeclarationAndCaptures() {
        var context = new GenerationContext();
        var first = BlockScriptTestSupport.decode(BlockScriptTestSupport.SCENARIO_A).get(0);
        var second = BlockScriptTestSupport.decode(BlockScriptTestSupport.SCENARIO_A.replace("=> VAR", "=> CAP")).get(0);
        first.generate(context);
        assertEquals(
            "parsed = parseBetweenStrings(data, \"hello how are you\", \"hello\", \"you\", true, \"\", \"\");\n"
                + "data.markForCapture(\"parsed\");\n",
            second.generate(context));
        assertEquals(1, context.definedVariables().size());
    }

    @Test
    void unknownModeIsLineTagged() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        var ex = assertThrows(ScriptParseException.class, () -> parse.deserialize("input = \"x\"\nMODE:Foo", 2));
        assertEquals(3, ex.line());
        assertEquals("MODE:Foo", ex.excerpt());
        assertEquals("parse_error", ex.code());
        assertTrue(ex.getMessage().startsWith("Line 3: Could not understand the parsing mode"), ex.getMessage());
    }

    @Test
    void bogusSettingFailsSerialize() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        parse.settings().put("bogus", new BlockSetting("bogus", FixedValue.of("x")));
        var ex = assertThrows(InvalidSettingException.class, () -> parse.serialize());
        assertEquals("bogus", ex.settingName());
        assertThrows(InvalidSettingException.class, () -> parse.generate(new GenerationContext()));
    }

    @Test
    void readsModesAndFlags() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        parse.deserialize(String.join("\n",
            "LABEL:Grab token",
            "DISABLED",
            "RECURSIVE",
            "jToken = \"user.id\"",
            "MODE:Json",
            "=> cap @ my token "), 1);
        assertTrue(parse.isDisabled());
        assertEquals("Grab token", parse.label());
        assertTrue(parse.isRecursive());
        assertEquals(ParseMode.JSON, parse.mode());
        assertTrue(parse.isCapture());
        assertEquals("mytoken", parse.outputVariable());
    }

    @Test
    void modeTokensAreCaseSensitive() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        assertThrows(ScriptParseException.class, () -> parse.deserialize("MODE:json", 1));
    }

    @Test
    void malformedOutputDeclarationIsRejected() {
        for (String line : new String[] {"=> FOO @x", "=> VAR x", "=>VAR", "=> VAR @"}) {
            ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
            var ex = assertThrows(ScriptParseException.class, () -> parse.deserialize(line, 4), line);
            assertEquals(4, ex.line());
            assertTrue(ex.detail().startsWith("The output variable declaration is in the wrong format"), ex.detail());
        }
    }

    @Test
    void symbolOnlyOutputNameStillDeclaresAnIdentifier() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        parse.deserialize("MODE:LR\n=> VAR @-", 1);
        assertEquals("_output", parse.outputVariable());
        assertTrue(parse.generate(new GenerationContext()).startsWith("var _output = parseBetweenStrings("));
    }

    @Test
    void eachModeCallsItsOwnFunction() {
        ParseBlockInstance css = BlockScriptTestSupport.newBlock("Parse");
        css.setMode(ParseMode.CSS);
        css.setRecursive(true);
        css.setSetting("cssSelector", FixedValue.of("a.link"));
        assertEquals("var parseOutput = queryCssSelectorRecursive(data, data.SOURCE, \"a.link\", \"innerText\", \"\", \"\");\n",
            css.generate(new GenerationContext()));

        ParseBlockInstance regex = BlockScriptTestSupport.newBlock("Parse");
        regex.setMode(ParseMode.REGEX);
        regex.setSetting("pattern", FixedValue.of("id=(\\d+)"));
        regex.setSetting("outputFormat", FixedValue.of("[1]"));
        assertEquals("var parseOutput = matchRegexGroups(data, data.SOURCE, \"id=(\\\\d+)\", \"[1]\", \"\", \"\");\n",
            regex.generate(new GenerationContext()));

        ParseBlockInstance json = BlockScriptTestSupport.newBlock("Parse");
        json.setMode(ParseMode.JSON);
        json.setSetting("jToken", FixedValue.of("token"));
        json.setSetting("prefix", FixedValue.of("<"));
        assertEquals("var parseOutput = queryJsonToken(data, data.SOURCE, \"token\", \"<\", \"\");\n",
            json.generate(new GenerationContext()));
    }

    @Test
    void globalOutputNeverDeclares() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        parse.setOutputVariable("globals.session");
        var context = new GenerationContext();
        assertEquals("globals.put(\"session\", parseBetweenStrings(data, data.SOURCE, \"\", \"\", true, \"\", \"\"));\n",
            parse.generate(context));
        assertTrue(context.definedVariables().isEmpty());
    }

    @Test
    void disabledBlockDoesNotRegisterVariable() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        parse.setDisabled(true);
        var context = new GenerationContext();
        assertTrue(parse.generate(context).startsWith("var parseOutput = "));
        assertTrue(context.definedVariables().isEmpty());
    }

    @Test
    void serializesInFixedOrder() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        parse.setDisabled(true);
        parse.setLabel("Token");
        parse.setRecursive(true);
        parse.setCapture(true);
        parse.setOutputVariable("token");
        var lines = parse.serialize().split("\n");
        assertEquals("  DISABLED", lines[0]);
        assertEquals("  LABEL:Token", lines[1]);
        assertEquals("  input = @data.SOURCE", lines[2]);
        assertEquals("  outputFormat = \"\"", lines[12]);
        assertEquals("  RECURSIVE", lines[13]);
        assertEquals("  MODE:LR", lines[14]);
        assertEquals("  => CAP @token", lines[15]);
        assertEquals(16, lines.length);
    }

    @Test
    void defaultLabelIsNotWritten() {
        ParseBlockInstance parse = BlockScriptTestSupport.newBlock("Parse");
        assertFalse(parse.serialize().contains("LABEL:"));
        assertFalse(parse.serialize().contains("DISABLED"));
    }
}
