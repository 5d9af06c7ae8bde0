package work.blockscript.block;

import java.util.Optional;

/**
 * Comparison operators usable in keycheck keys, written with their script token (e.g. {@code Contains}).
 */
public enum Comparison {
    EQUAL_TO("EqualTo"),
    NOT_EQUAL_TO("NotEqualTo"),
    CONTAINS("Contains"),
    DOES_NOT_CONTAIN("DoesNotContain"),
    MATCHES_REGEX("MatchesRegex"),
    DOES_NOT_MATCH_REGEX("DoesNotMatchRegex"),
    LESS_THAN("LessThan"),
    LESS_THAN_OR_EQUAL_TO("LessThanOrEqualTo"),
    GREATER_THAN("GreaterThan"),
    GREATER_THAN_OR_EQUAL_TO("GreaterThanOrEqualTo"),
    IS("Is"),
    IS_NOT("IsNot");

    private final String token;

    Comparison(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static Optional<Comparison> fromToken(String token) {
        for (Comparison comparison : values()) {
            if (comparison.token.equals(token)) {
                return Optional.of(comparison);
            }
        }
        return Optional.empty();
    }
}
