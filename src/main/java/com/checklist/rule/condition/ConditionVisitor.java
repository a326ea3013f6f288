package com.checklist.rule.condition;

/**
 * Exhaustive dispatch over {@link Condition} variants.
 *
 * @param <R> Result type
 */
public interface ConditionVisitor<R> {

    R visitBoolean(BooleanCondition condition);

    R visitCount(CountCondition condition);

    R visitComparison(ComparisonCondition condition);

    R visitRange(RangeCondition condition);

    R visitSelection(SelectionCondition condition);
}
