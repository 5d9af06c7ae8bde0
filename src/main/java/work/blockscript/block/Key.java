package work.blockscript.block;

import java.util.Objects;
import work.blockscript.setting.SettingValue;

/**
 * One condition of a keychain: {@code left <comparison> right}.
 */
public record Key(KeyType type, SettingValue left, Comparison comparison, SettingValue right) {
    public Key {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(comparison, "comparison");
        Objects.requireNonNull(right, "right");
    }
}
