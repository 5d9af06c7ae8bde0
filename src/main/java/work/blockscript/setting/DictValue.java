package work.blockscript.setting;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered string-keyed mapping (headers, cookies, JWT claims...).
 */
public record DictValue(Map<String, SettingValue> entries) implements SettingValue {
    public DictValue {
        entries = entries == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static DictValue ofStrings(Map<String, String> values) {
        var entries = new LinkedHashMap<String, SettingValue>();
        values.forEach((key, value) -> entries.put(key, FixedValue.of(value)));
        return new DictValue(entries);
    }
}
