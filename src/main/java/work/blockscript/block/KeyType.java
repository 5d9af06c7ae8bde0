package work.blockscript.block;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import work.blockscript.descriptor.ParamType;

/**
 * Operand type of a keycheck key, selecting the line keyword, the operand literal type and the
 * runtime comparison enum.
 */
public enum KeyType {
    STRING("STRINGKEY", ParamType.STRING, "StrComparison", EnumSet.of(
        Comparison.EQUAL_TO, Comparison.NOT_EQUAL_TO, Comparison.CONTAINS, Comparison.DOES_NOT_CONTAIN,
        Comparison.MATCHES_REGEX, Comparison.DOES_NOT_MATCH_REGEX)),
    INT("INTKEY", ParamType.INT, "NumComparison", numeric()),
    FLOAT("FLOATKEY", ParamType.FLOAT, "NumComparison", numeric()),
    BOOL("BOOLKEY", ParamType.BOOL, "BoolComparison", EnumSet.of(Comparison.IS, Comparison.IS_NOT));

    private final String keyword;
    private final ParamType operandType;
    private final String comparisonType;
    private final Set<Comparison> comparisons;

    KeyType(String keyword, ParamType operandType, String comparisonType, Set<Comparison> comparisons) {
        this.keyword = keyword;
        this.operandType = operandType;
        this.comparisonType = comparisonType;
        this.comparisons = comparisons;
    }

    public String keyword() {
        return keyword;
    }

    public ParamType operandType() {
        return operandType;
    }

    public String comparisonType() {
        return comparisonType;
    }

    public boolean supports(Comparison comparison) {
        return comparisons.contains(comparison);
    }

    public static Optional<KeyType> fromKeyword(String keyword) {
        for (KeyType type : values()) {
            if (type.keyword.equals(keyword)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static Set<Comparison> numeric() {
        return EnumSet.of(
            Comparison.EQUAL_TO, Comparison.NOT_EQUAL_TO, Comparison.LESS_THAN,
            Comparison.LESS_THAN_OR_EQUAL_TO, Comparison.GREATER_THAN, Comparison.GREATER_THAN_OR_EQUAL_TO);
    }
}
