package work.blockscript.setting;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * A literal scalar: string, enum token, integer, floating point, boolean or raw bytes.
 */
public final class FixedValue implements SettingValue {
    private final Object value;

    private FixedValue(Object value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public static FixedValue of(String value) {
        return new FixedValue(value);
    }

    public static FixedValue of(int value) {
        return new FixedValue(value);
    }

    public static FixedValue of(double value) {
        return new FixedValue(value);
    }

    public static FixedValue of(boolean value) {
        return new FixedValue(value);
    }

    public static FixedValue ofBytes(byte[] value) {
        return new FixedValue(value.clone());
    }

    public Object value() {
        return value instanceof byte[] bytes ? bytes.clone() : value;
    }

    public String asString() {
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FixedValue that)) {
            return false;
        }
        if (value instanceof byte[] mine && that.value instanceof byte[] theirs) {
            return Arrays.equals(mine, theirs);
        }
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value instanceof byte[] bytes ? Arrays.hashCode(bytes) : value.hashCode();
    }

    @Override
    public String toString() {
        return "FixedValue[" + asString() + "]";
    }
}
