package work.blockscript.descriptor;

import java.util.Locale;

/**
 * Value types a block parameter can declare.
 */
public enum ParamType {
    STRING,
    INT,
    FLOAT,
    BOOL,
    BYTES,
    ENUM,
    LIST,
    DICT;

    public static ParamType from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Parameter type is required");
        }
        try {
            return ParamType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported parameter type: " + value);
        }
    }

    public boolean acceptsInterpolation() {
        return this == STRING || this == LIST || this == DICT;
    }
}
