package com.checklist.batch;

import com.checklist.exception.RulesException;
import com.checklist.rule.Rule;

import java.util.Optional;

/**
 * Result of compiling one {@link RuleCell}: either an expression or the failure.
 *
 * @param cell       Source cell
 * @param rule       Parsed rule, null on failure
 * @param expression Emitted expression, null on failure
 * @param error      Failure, null on success
 */
public record RuleOutcome(RuleCell cell, Rule rule, String expression, RulesException error) {

    public static RuleOutcome success(RuleCell cell, Rule rule, String expression) {
        return new RuleOutcome(cell, rule, expression, null);
    }

    public static RuleOutcome failure(RuleCell cell, RulesException error) {
        return new RuleOutcome(cell, null, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<String> getExpression() {
        return Optional.ofNullable(expression);
    }

    public Optional<RulesException> getError() {
        return Optional.ofNullable(error);
    }
}
