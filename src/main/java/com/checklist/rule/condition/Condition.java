package com.checklist.rule.condition;

/**
 * The condition part of a rule. The set of variants is closed; callers
 * dispatch over it with a {@link ConditionVisitor}.
 */
public sealed interface Condition
        permits BooleanCondition, CountCondition, ComparisonCondition, RangeCondition, SelectionCondition {

    <R> R accept(ConditionVisitor<R> visitor);
}
