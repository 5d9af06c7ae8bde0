package work.blockscript.error;

/**
 * No code mapping exists for the requested block/mode combination.
 */
public final class UnsupportedGenerationException extends BlockScriptException {
    public UnsupportedGenerationException(String detail, int line, String excerpt) {
        super("unsupported", detail, line, excerpt, null);
    }
}
