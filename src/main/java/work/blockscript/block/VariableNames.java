package work.blockscript.block;

import java.util.Set;
import work.blockscript.setting.VariableRef;

/**
 * Sanitizes user supplied output variable names into Java identifiers.
 */
public final class VariableNames {
    static final String FALLBACK = "_output";

    private static final Set<String> RESERVED = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "var", "true", "false", "null", "_", "data", "globals"
    );

    private VariableNames() {}

    public static String makeValid(String name) {
        if (name == null) {
            return FALLBACK;
        }
        String trimmed = name.trim();
        if (isGlobal(trimmed)) {
            return VariableRef.GLOBALS_PREFIX + sanitize(trimmed.substring(VariableRef.GLOBALS_PREFIX.length()));
        }
        return sanitize(trimmed);
    }

    public static boolean isGlobal(String name) {
        return name != null && name.startsWith(VariableRef.GLOBALS_PREFIX);
    }

    private static String sanitize(String name) {
        var builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_') {
                builder.append(c);
            }
        }
        if (builder.length() == 0) {
            return FALLBACK;
        }
        if (Character.isDigit(builder.charAt(0)) || RESERVED.contains(builder.toString())) {
            builder.insert(0, '_');
        }
        return builder.toString();
    }
}
