package com.checklist.rule;

import com.checklist.rule.condition.Condition;

import java.util.Objects;

/**
 * Assigns {@code target} to the checklist item when {@code condition} holds.
 *
 * @param condition Condition of any kind
 * @param target    Score assigned when the condition holds
 */
public record ScoringRule(Condition condition, CeeScore target) implements Rule {

    public ScoringRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(target, "target");
    }
}
