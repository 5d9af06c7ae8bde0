package work.blockscript.error;

/**
 * Raised when a block id has no registered descriptor.
 */
public final class UnknownBlockKindException extends BlockScriptException {
    private final String kindId;

    public UnknownBlockKindException(String kindId) {
        this(kindId, 0, null);
    }

    public UnknownBlockKindException(String kindId, int line, String excerpt) {
        super("unknown_kind", "Unknown block kind: " + kindId, line, excerpt, null);
        this.kindId = kindId;
    }

    public String kindId() {
        return kindId;
    }
}
