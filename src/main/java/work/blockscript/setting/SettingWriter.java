package work.blockscript.setting;

import java.util.ArrayList;
import java.util.List;
import work.blockscript.descriptor.ParamSchema;
import work.blockscript.descriptor.ParamType;

/**
 * Writes settings back to script notation; the inverse of {@link SettingParser}.
 */
public final class SettingWriter {
    private SettingWriter() {}

    public static String write(BlockSetting setting, ParamSchema schema) {
        return setting.name() + " = " + writeValue(setting.value(), schema.type());
    }

    public static String writeValue(SettingValue value, ParamType type) {
        if (value instanceof VariableRef ref) {
            return "@" + ref.name();
        }
        if (value instanceof Interpolated interpolated) {
            return "$" + JavaLiterals.quoteScript(interpolated.template());
        }
        if (value instanceof ListValue list) {
            List<String> items = new ArrayList<>();
            for (var item : list.items()) {
                items.add(writeValue(item, ParamType.STRING));
            }
            return "[" + String.join(", ", items) + "]";
        }
        if (value instanceof DictValue dict) {
            List<String> entries = new ArrayList<>();
            dict.entries().forEach((key, item) ->
                entries.add("(" + JavaLiterals.quoteScript(key) + ", " + writeValue(item, ParamType.STRING) + ")"));
            return "{" + String.join(", ", entries) + "}";
        }
        if (value instanceof FixedValue fixed) {
            Object raw = fixed.value();
            if (raw instanceof Boolean bool) {
                return bool ? "True" : "False";
            }
            if (raw instanceof Number) {
                return String.valueOf(raw);
            }
            if (raw instanceof byte[] || type != ParamType.ENUM) {
                return JavaLiterals.quoteScript(fixed.asString());
            }
            return fixed.asString();
        }
        throw new IllegalArgumentException("Unsupported setting value: " + value);
    }
}
