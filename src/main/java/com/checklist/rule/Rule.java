package com.checklist.rule;

import com.checklist.rule.condition.Condition;

/**
 * A single parsed rule: either a scoring rule or a skip rule.
 */
public sealed interface Rule permits ScoringRule, SkipRule {

    /**
     * The condition this rule tests.
     */
    Condition condition();
}
