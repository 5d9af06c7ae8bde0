package work.blockscript.block;

import java.util.Optional;

/**
 * Parse strategies as written after {@code MODE:}. Tokens are case-sensitive.
 */
public enum ParseMode {
    LR("LR"),
    CSS("CSS"),
    JSON("Json"),
    REGEX("Regex");

    private final String token;

    ParseMode(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<ParseMode> fromToken(String token) {
        for (ParseMode mode : values()) {
            if (mode.token.equals(token)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
