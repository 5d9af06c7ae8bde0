package work.blockscript.setting;

import java.util.Objects;

/**
 * Reads a variable at runtime. Names starting with {@code globals.} address the persistent global store.
 */
public record VariableRef(String name) implements SettingValue {
    public static final String GLOBALS_PREFIX = "globals.";

    public VariableRef {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name must not be blank");
        }
    }

    public boolean isGlobal() {
        return name.startsWith(GLOBALS_PREFIX);
    }
}
