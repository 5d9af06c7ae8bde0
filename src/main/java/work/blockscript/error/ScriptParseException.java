package work.blockscript.error;

/**
 * Malformed script text: header tokens, output declarations or setting syntax.
 */
public final class ScriptParseException extends BlockScriptException {
    public ScriptParseException(int line, String excerpt, String detail) {
        this(line, excerpt, detail, null);
    }

    public ScriptParseException(int line, String excerpt, String detail, Throwable cause) {
        super("parse_error", detail, line, excerpt, cause);
    }
}
