package com.checklist.rule.condition;

import com.checklist.rule.Comparator;

import java.util.Objects;

/**
 * A single threshold test such as {@code >=80%}.
 *
 * @param comparator Comparison operator
 * @param threshold  Right-hand operand
 * @param percent    Whether the threshold carried a {@code %} suffix
 */
public record ComparisonLeaf(Comparator comparator, int threshold, boolean percent)
        implements ComparisonExpression {

    public ComparisonLeaf {
        Objects.requireNonNull(comparator, "comparator");
        if (threshold < 0) {
            throw new IllegalArgumentException("Threshold must not be negative: " + threshold);
        }
    }
}
