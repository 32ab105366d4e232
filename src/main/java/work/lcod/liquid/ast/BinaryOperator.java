package work.lcod.liquid.ast;

import java.util.Locale;

public enum BinaryOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    AND("and"),
    OR("or"),
    CONTAINS("contains"),
    LOWER_THAN("<"),
    GREATER_THAN(">"),
    STARTS_WITH("startswith"),
    ENDS_WITH("endswith");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its enum name or its template symbol. {@code <=} and {@code >=}
     * map to the non-strict comparisons, see {@link #isStrictSymbol(String)}.
     */
    public static BinaryOperator from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Missing operator");
        }
        var normalized = raw.trim();
        switch (normalized) {
            case "<=":
                return LOWER_THAN;
            case ">=":
                return GREATER_THAN;
            case "<>":
                return NOT_EQUAL;
            default:
                break;
        }
        for (var operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return operator;
            }
        }
        var upper = normalized.toUpperCase(Locale.ROOT).replace('-', '_');
        for (var operator : values()) {
            if (operator.name().equals(upper)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + raw);
    }

    public static boolean isStrictSymbol(String raw) {
        return raw == null || !(raw.trim().equals("<=") || raw.trim().equals(">="));
    }
}
