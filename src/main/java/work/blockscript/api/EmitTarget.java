package work.blockscript.api;

import java.util.Locale;

/**
 * What a compilation writes out.
 */
public enum EmitTarget {
    /** Generated Java statements. */
    CODE,
    /** The script re-encoded in canonical text form. */
    SCRIPT,
    /** A JSON outline of the decoded blocks. */
    JSON;

    public static EmitTarget from(String value) {
        if (value == null || value.isBlank()) {
            return CODE;
        }
        try {
            return EmitTarget.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported emit target: " + value);
        }
    }
}
