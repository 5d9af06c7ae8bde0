package work.blockscript.setting;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.blockscript.descriptor.BlockDescriptor;
import work.blockscript.descriptor.BlockKind;
import work.blockscript.descriptor.ParamSchema;
import work.blockscript.descriptor.ParamType;

class SettingParserTest {
    private static final BlockDescriptor DESCRIPTOR = BlockDescriptor.builder("Sample", BlockKind.FUNCTION)
        .parameter(ParamSchema.of("text", ParamType.STRING))
        .parameter(ParamSchema.of("count", ParamType.INT))
        .parameter(ParamSchema.of("ratio", ParamType.FLOAT))
        .parameter(ParamSchema.of("enabled", ParamType.BOOL))
        .parameter(ParamSchema.of("payload", ParamType.BYTES))
        .parameter(ParamSchema.ofEnum("mode", "CipherMode", List.of("CBC", "ECB"), "CBC"))
        .parameter(ParamSchema.of("items", ParamType.LIST))
        .parameter(ParamSchema.of("headers", ParamType.DICT))
        .build();

    @Test
    void parsesQuotedStringWithEscapes() {
        var setting = SettingParser.parseLine("text = \"say \\\"hi\\\"\\n\\tnow\"", DESCRIPTOR);
        assertEquals("text", setting.name());
        assertEquals(FixedValue.of("say \"hi\"\n\tnow"), setting.value());
    }

    @Test
    void parsesScalarsByDeclaredType() {
        assertEquals(FixedValue.of(42), SettingParser.parseLine("count = 42", DESCRIPTOR).value());
        assertEquals(FixedValue.of(-1.5d), SettingParser.parseLine("ratio = -1.5", DESCRIPTOR).value());
        assertEquals(FixedValue.of(false), SettingParser.parseLine("enabled = False", DESCRIPTOR).value());
        assertEquals(FixedValue.of(true), SettingParser.parseLine("enabled = true", DESCRIPTOR).value());
        assertEquals(FixedValue.of("ECB"), SettingParser.parseLine("mode = ECB", DESCRIPTOR).value());
    }

    @Test
    void parsesBase64Bytes() {
        var value = (FixedValue) SettingParser.parseLine("payload = \"AQID\"", DESCRIPTOR).value();
        assertArrayEquals(new byte[] {1, 2, 3}, (byte[]) value.value());
        assertEquals(FixedValue.ofBytes(new byte[] {1, 2, 3}), value);
    }

    @Test
    void acceptsVariablesForEveryType() {
        assertEquals(new VariableRef("data.SOURCE"), SettingParser.parseLine("text = @data.SOURCE", DESCRIPTOR).value());
        assertEquals(new VariableRef("retries"), SettingParser.parseLine("count = @retries", DESCRIPTOR).value());
        assertEquals(new VariableRef("globals.flag"), SettingParser.parseLine("enabled = @globals.flag", DESCRIPTOR).value());
    }

    @Test
    void parsesInterpolatedTemplate() {
        var value = SettingParser.parseLine("text = $\"Hello <name>\"", DESCRIPTOR).value();
        assertEquals(new Interpolated("Hello <name>"), value);
    }

    @Test
    void parsesListAndDict() {
        var list = SettingParser.parseLine("items = [\"a\", @b, $\"c<d>\"]", DESCRIPTOR).value();
        assertEquals(new ListValue(List.of(FixedValue.of("a"), new VariableRef("b"), new Interpolated("c<d>"))), list);

        var dict = SettingParser.parseLine("headers = {(\"Accept\", \"*/*\"), (\"X-Token\", @token)}", DESCRIPTOR).value();
        assertEquals(new DictValue(Map.of("Accept", FixedValue.of("*/*"), "X-Token", new VariableRef("token"))), dict);
        assertEquals(List.of("Accept", "X-Token"), List.copyOf(((DictValue) dict).entries().keySet()));

        assertEquals(new ListValue(List.of()), SettingParser.parseLine("items = []", DESCRIPTOR).value());
        assertEquals(new DictValue(Map.of()), SettingParser.parseLine("headers = {}", DESCRIPTOR).value());
    }

    @Test
    void rejectsLiteralsThatDoNotMatchTheType() {
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("count = \"42\"", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("count = 4.5", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("enabled = yes", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("mode = CTR", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("count = $\"1<x>\"", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("payload = \"not base64!\"", DESCRIPTOR));
    }

    @Test
    void rejectsFloatsOutsideTheDoubleRange() {
        var ex = assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("ratio = 1e400", DESCRIPTOR));
        assertTrue(ex.getMessage().contains("number out of range"), ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("ratio = -1e400", DESCRIPTOR));
        assertEquals(FixedValue.of(1e300), SettingParser.parseLine("ratio = 1e300", DESCRIPTOR).value());
    }

    @Test
    void rejectsMalformedLines() {
        var unknown = assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("bogus = 1", DESCRIPTOR));
        assertTrue(unknown.getMessage().contains("bogus"));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("text \"x\"", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("text = \"open", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("text = \"a\" trailing", DESCRIPTOR));
        assertThrows(IllegalArgumentException.class, () -> SettingParser.parseLine("text =", DESCRIPTOR));
    }
}
