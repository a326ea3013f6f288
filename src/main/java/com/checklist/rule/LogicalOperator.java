package com.checklist.rule;

/**
 * Connectives for compound comparison and selection expressions.
 */
public enum LogicalOperator {
    AND("and"),
    OR("or");

    private final String keyword;

    LogicalOperator(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
