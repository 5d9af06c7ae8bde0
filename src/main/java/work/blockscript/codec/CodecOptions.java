package work.blockscript.codec;

/**
 * Encoding switches. With {@code printDefaults} off, settings still holding their descriptor
 * default are left out of the written script.
 */
public record CodecOptions(boolean printDefaults) {
    private static final CodecOptions DEFAULTS = new CodecOptions(true);

    public static CodecOptions defaults() {
        return DEFAULTS;
    }

    public static CodecOptions compact() {
        return new CodecOptions(false);
    }
}
