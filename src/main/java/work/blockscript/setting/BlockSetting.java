package work.blockscript.setting;

import java.util.Objects;

/**
 * Binds a value to one parameter of a block instance.
 */
public record BlockSetting(String name, SettingValue value) {
    public BlockSetting {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    public BlockSetting withValue(SettingValue newValue) {
        return new BlockSetting(name, newValue);
    }
}
