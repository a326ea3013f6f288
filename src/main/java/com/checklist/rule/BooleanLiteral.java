package com.checklist.rule;

import java.util.Optional;

/**
 * Yes/no answer literal, written {@code Y} or {@code N}.
 */
public enum BooleanLiteral {
    YES("Y"),
    NO("N");

    private final String symbol;

    BooleanLiteral(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public BooleanLiteral negate() {
        return this == YES ? NO : YES;
    }

    public static Optional<BooleanLiteral> fromSymbol(String symbol) {
        for (BooleanLiteral literal : values()) {
            if (literal.symbol.equals(symbol)) {
                return Optional.of(literal);
            }
        }
        return Optional.empty();
    }
}
