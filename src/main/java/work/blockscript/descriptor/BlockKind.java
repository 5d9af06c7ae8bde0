package work.blockscript.descriptor;

import java.util.Locale;

/**
 * Closed set of block variants. Each descriptor names the variant that parses and generates it.
 */
public enum BlockKind {
    PARSE,
    FUNCTION,
    HTTP_REQUEST,
    KEYCHECK,
    SCRIPT;

    public static BlockKind from(String value) {
        if (value == null || value.isBlank()) {
            return FUNCTION;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return BlockKind.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported block kind: " + value);
        }
    }
}
