package work.blockscript.shared;

/**
 * Shortens offending source lines for diagnostics (e.g. {@code MODE:Foo}).
 */
public final class Excerpts {
    public static final int MAX_LENGTH = 50;
    private static final String ELLIPSIS = "...";

    private Excerpts() {}

    public static String truncate(String text) {
        return truncate(text, MAX_LENGTH);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }
}
