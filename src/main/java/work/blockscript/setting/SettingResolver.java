package work.blockscript.setting;

import java.util.ArrayList;
import java.util.List;
import work.blockscript.descriptor.ParamSchema;
import work.blockscript.descriptor.ParamType;

/**
 * Turns setting values into Java expressions for the generated program. The enclosing program
 * template imports {@code java.util.*} and declares {@code data} and {@code globals}.
 */
public final class SettingResolver {
    private SettingResolver() {}

    public static String resolve(BlockSetting setting, ParamSchema schema) {
        return resolve(setting.value(), schema.type(), schema.enumType());
    }

    public static String resolve(SettingValue value, ParamType type, String enumType) {
        if (value instanceof VariableRef ref) {
            return readVariable(ref.name());
        }
        if (value instanceof Interpolated interpolated) {
            return interpolate(interpolated.template());
        }
        if (value instanceof ListValue list) {
            List<String> items = new ArrayList<>();
            for (var item : list.items()) {
                items.add(resolve(item, ParamType.STRING, null));
            }
            return "List.of(" + String.join(", ", items) + ")";
        }
        if (value instanceof DictValue dict) {
            if (dict.entries().isEmpty()) {
                return "Map.of()";
            }
            List<String> entries = new ArrayList<>();
            dict.entries().forEach((key, item) ->
                entries.add("Map.entry(" + JavaLiterals.quoteJava(key) + ", " + resolve(item, ParamType.STRING, null) + ")"));
            return "Map.ofEntries(" + String.join(", ", entries) + ")";
        }
        if (value instanceof FixedValue fixed) {
            return literal(fixed, type, enumType);
        }
        throw new IllegalArgumentException("Unsupported setting value: " + value);
    }

    public static String readVariable(String name) {
        if (name.startsWith(VariableRef.GLOBALS_PREFIX)) {
            return "globals.get(" + JavaLiterals.quoteJava(name.substring(VariableRef.GLOBALS_PREFIX.length())) + ")";
        }
        return name;
    }

    static String interpolate(String template) {
        var parts = InterpolationTemplate.parse(template);
        if (parts.isEmpty()) {
            return "\"\"";
        }
        List<String> pieces = new ArrayList<>();
        if (parts.get(0).variable()) {
            pieces.add("\"\"");
        }
        for (var part : parts) {
            pieces.add(part.variable() ? readVariable(part.text()) : JavaLiterals.quoteJava(part.text()));
        }
        return String.join(" + ", pieces);
    }

    private static String literal(FixedValue fixed, ParamType type, String enumType) {
        Object raw = fixed.value();
        if (raw instanceof Boolean bool) {
            return bool.toString();
        }
        if (raw instanceof Integer number) {
            return number.toString();
        }
        if (raw instanceof Double number) {
            if (number.isNaN()) {
                return "Double.NaN";
            }
            if (number.isInfinite()) {
                return number > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
            }
            return number.toString();
        }
        if (raw instanceof byte[] bytes) {
            return bytes.length == 0
                ? "new byte[0]"
                : "Base64.getDecoder().decode(" + JavaLiterals.quoteJava(fixed.asString()) + ")";
        }
        if (type == ParamType.ENUM && enumType != null && !enumType.isBlank()) {
            return enumType + "." + raw;
        }
        return JavaLiterals.quoteJava(String.valueOf(raw));
    }
}
