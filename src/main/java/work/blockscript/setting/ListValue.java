package work.blockscript.setting;

import java.util.List;

public record ListValue(List<SettingValue> items) implements SettingValue {
    public ListValue {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ListValue ofStrings(List<String> values) {
        return new ListValue(values.stream().<SettingValue>map(FixedValue::of).toList());
    }
}
