package com.checklist.rule;

import com.checklist.rule.condition.BooleanCondition;
import com.checklist.rule.condition.ComparisonCondition;
import com.checklist.rule.condition.Condition;
import com.checklist.rule.condition.CountCondition;

import java.util.Objects;

/**
 * Shows {@code targetQuestion} only when {@code condition} holds.
 * Only boolean, count and comparison conditions can drive a skip.
 *
 * @param condition      Boolean, count or comparison condition
 * @param targetQuestion Question made relevant by the condition
 */
public record SkipRule(Condition condition, QuestionRef targetQuestion) implements Rule {

    public SkipRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(targetQuestion, "targetQuestion");
        if (!(condition instanceof BooleanCondition
                || condition instanceof CountCondition
                || condition instanceof ComparisonCondition)) {
            throw new IllegalArgumentException("Skip rules do not support " + condition);
        }
    }
}
