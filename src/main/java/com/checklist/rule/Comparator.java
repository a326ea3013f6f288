package com.checklist.rule;

/**
 * Numeric comparison operators of the rule language.
 */
public enum Comparator {
    GE(">=", ">="),
    GT(">", ">"),
    LE("=<", "<="),
    LT("<", "<");

    private final String symbol;
    private final String xpathSymbol;

    Comparator(String symbol, String xpathSymbol) {
        this.symbol = symbol;
        this.xpathSymbol = xpathSymbol;
    }

    /**
     * Canonical spelling in rule text.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Spelling in XPath.
     */
    public String xpathSymbol() {
        return xpathSymbol;
    }
}
