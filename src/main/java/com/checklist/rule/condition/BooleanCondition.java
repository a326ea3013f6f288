package com.checklist.rule.condition;

import com.checklist.rule.BooleanLiteral;

import java.util.Objects;

/**
 * Condition that holds when a yes/no question was answered {@code value}.
 */
public record BooleanCondition(BooleanLiteral value) implements Condition {

    public BooleanCondition {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
