package com.checklist.rule.condition;

/**
 * Condition that holds when the number of selected options lies in
 * {@code [low, high]}. Bound order is checked by the validator.
 */
public record RangeCondition(int low, int high) implements Condition {

    public RangeCondition {
        if (low < 0 || high < 0) {
            throw new IllegalArgumentException("Range bounds must not be negative: " + low + "-" + high);
        }
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitRange(this);
    }
}
