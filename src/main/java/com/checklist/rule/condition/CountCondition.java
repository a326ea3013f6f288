package com.checklist.rule.condition;

/**
 * Condition that holds when exactly {@code count} options were selected.
 */
public record CountCondition(int count) implements Condition {

    public CountCondition {
        if (count < 0) {
            throw new IllegalArgumentException("Count must not be negative: " + count);
        }
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitCount(this);
    }
}
