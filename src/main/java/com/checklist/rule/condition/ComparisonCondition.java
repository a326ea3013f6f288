package com.checklist.rule.condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Condition made of one or more threshold comparisons joined by and/or.
 *
 * @param expression Root of the comparison tree
 */
public record ComparisonCondition(ComparisonExpression expression) implements Condition {

    public ComparisonCondition {
        Objects.requireNonNull(expression, "expression");
    }

    /**
     * Leaves of the tree, left to right.
     */
    public List<ComparisonLeaf> leaves() {
        List<ComparisonLeaf> leaves = new ArrayList<>();
        collect(expression, leaves);
        return leaves;
    }

    private static void collect(ComparisonExpression node, List<ComparisonLeaf> leaves) {
        if (node instanceof ComparisonLeaf leaf) {
            leaves.add(leaf);
        } else if (node instanceof ComparisonJunction junction) {
            collect(junction.left(), leaves);
            collect(junction.right(), leaves);
        }
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
