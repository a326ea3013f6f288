package com.checklist.rule.condition;

import com.checklist.rule.LogicalOperator;

import java.util.Objects;

/**
 * Two comparison subtrees joined by {@code and} or {@code or}.
 * Trees grow to the left only: rule text has no parentheses, so a junction
 * on the right could not be written back.
 */
public record ComparisonJunction(LogicalOperator operator, ComparisonExpression left, ComparisonExpression right)
        implements ComparisonExpression {

    public ComparisonJunction {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        if (!(right instanceof ComparisonLeaf)) {
            throw new IllegalArgumentException("Right operand of '" + operator.keyword()
                    + "' must be a single comparison: " + right);
        }
    }
}
