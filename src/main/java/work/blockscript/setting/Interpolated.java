package work.blockscript.setting;

import java.util.Objects;

/**
 * String template with {@code <variable>} placeholders.
 */
public record Interpolated(String template) implements SettingValue {
    public Interpolated {
        Objects.requireNonNull(template, "template");
    }
}
