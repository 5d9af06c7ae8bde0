package work.blockscript.descriptor;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.blockscript.setting.BlockSetting;
import work.blockscript.setting.DictValue;
import work.blockscript.setting.FixedValue;
import work.blockscript.setting.ListValue;
import work.blockscript.setting.SettingValue;

/**
 * Declares one parameter of a block: its type, default value and, for enums, the allowed tokens.
 * {@code enumType} is the runtime enum the generated code refers to (e.g. {@code HashFunction}).
 */
public record ParamSchema(String name, ParamType type, SettingValue defaultValue, List<String> enumValues, String enumType) {
    public ParamSchema {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        if (type == ParamType.ENUM && enumValues.isEmpty()) {
            throw new IllegalArgumentException("Enum parameter " + name + " declares no values");
        }
        if (defaultValue == null) {
            defaultValue = implicitDefault(type, enumValues);
        }
    }

    public static ParamSchema of(String name, ParamType type) {
        return new ParamSchema(name, type, null, List.of(), null);
    }

    public static ParamSchema of(String name, ParamType type, SettingValue defaultValue) {
        return new ParamSchema(name, type, defaultValue, List.of(), null);
    }

    public static ParamSchema ofEnum(String name, String enumType, List<String> values, String defaultToken) {
        SettingValue defaultValue = defaultToken == null ? null : FixedValue.of(defaultToken);
        return new ParamSchema(name, ParamType.ENUM, defaultValue, values, enumType);
    }

    public BlockSetting toBlockSetting() {
        return new BlockSetting(name, defaultValue);
    }

    public boolean isDefault(SettingValue value) {
        return defaultValue.equals(value);
    }

    private static SettingValue implicitDefault(ParamType type, List<String> enumValues) {
        return switch (type) {
            case STRING -> FixedValue.of("");
            case INT -> FixedValue.of(0);
            case FLOAT -> FixedValue.of(0.0d);
            case BOOL -> FixedValue.of(false);
            case BYTES -> FixedValue.ofBytes(new byte[0]);
            case ENUM -> FixedValue.of(enumValues.get(0));
            case LIST -> new ListValue(List.of());
            case DICT -> new DictValue(Map.of());
        };
    }
}
