package work.blockscript.error;

import java.util.LinkedHashMap;
import java.util.Map;
import work.blockscript.shared.Excerpts;

/**
 * Base exception for codec and generator failures. Carries a stable error code plus the
 * 1-based source line and a short excerpt of the offending text, when known.
 */
public class BlockScriptException extends RuntimeException {
    private final String code;
    private final String detail;
    private final int line;
    private final String excerpt;

    protected BlockScriptException(String code, String detail, int line, String excerpt, Throwable cause) {
        super(format(detail, line), cause);
        this.code = code;
        this.detail = detail;
        this.line = Math.max(line, 0);
        this.excerpt = excerpt == null ? null : Excerpts.truncate(excerpt);
    }

    public String code() {
        return code;
    }

    /**
     * Message without the line prefix.
     */
    public String detail() {
        return detail;
    }

    public int line() {
        return line;
    }

    public String excerpt() {
        return excerpt;
    }

    public boolean hasLocation() {
        return line > 0;
    }

    public Map<String, Object> toDiagnostic() {
        var diagnostic = new LinkedHashMap<String, Object>();
        diagnostic.put("code", code);
        diagnostic.put("message", detail);
        if (hasLocation()) {
            diagnostic.put("line", line);
        }
        if (excerpt != null) {
            diagnostic.put("excerpt", excerpt);
        }
        return diagnostic;
    }

    private static String format(String detail, int line) {
        return line > 0 ? "Line " + line + ": " + detail : detail;
    }
}
