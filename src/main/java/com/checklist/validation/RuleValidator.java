package com.checklist.validation;

import com.checklist.exception.RuleValidationException;
import com.checklist.rule.Rule;
import com.checklist.rule.condition.BooleanCondition;
import com.checklist.rule.condition.ComparisonCondition;
import com.checklist.rule.condition.ComparisonLeaf;
import com.checklist.rule.condition.ConditionVisitor;
import com.checklist.rule.condition.CountCondition;
import com.checklist.rule.condition.RangeCondition;
import com.checklist.rule.condition.SelectionCondition;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import static com.checklist.exception.RuleValidationException.Kind.*;

/**
 * Checks rule invariants that the grammar alone does not enforce.
 */
public final class RuleValidator {

    static final int MAX_PERCENT = 100;

    private final DuplicateOptionPolicy duplicateOptionPolicy;

    public RuleValidator(DuplicateOptionPolicy duplicateOptionPolicy) {
        this.duplicateOptionPolicy = Objects.requireNonNull(duplicateOptionPolicy, "duplicateOptionPolicy");
    }

    /**
     * Validate a rule.
     *
     * @param rule Parsed rule
     * @throws RuleValidationException if an invariant does not hold
     */
    public void validate(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        rule.condition().accept(new Checks());
    }

    private final class Checks implements ConditionVisitor<Void> {

        @Override
        public Void visitBoolean(BooleanCondition condition) {
            return null;
        }

        @Override
        public Void visitCount(CountCondition condition) {
            return null;
        }

        @Override
        public Void visitComparison(ComparisonCondition condition) {
            for (ComparisonLeaf leaf : condition.leaves()) {
                if (leaf.percent() && leaf.threshold() > MAX_PERCENT) {
                    throw new RuleValidationException(PERCENT_OUT_OF_RANGE,
                            "Percentage threshold " + leaf.threshold() + "% exceeds " + MAX_PERCENT + "%");
                }
            }
            return null;
        }

        @Override
        public Void visitRange(RangeCondition condition) {
            if (condition.low() > condition.high()) {
                throw new RuleValidationException(INVERTED_RANGE,
                        "Range lower bound " + condition.low() + " exceeds upper bound " + condition.high());
            }
            return null;
        }

        @Override
        public Void visitSelection(SelectionCondition condition) {
            if (condition.options().isEmpty()) {
                throw new RuleValidationException(EMPTY_SELECTION, "Selection names no options");
            }
            Set<Integer> seen = new HashSet<>();
            for (int option : condition.options()) {
                if (option < 1) {
                    throw new RuleValidationException(INVALID_OPTION,
                            "Option index must be at least 1 but was #" + option);
                }
                if (!seen.add(option) && duplicateOptionPolicy == DuplicateOptionPolicy.REJECT) {
                    throw new RuleValidationException(DUPLICATE_OPTION,
                            "Option #" + option + " appears more than once in " + condition.options());
                }
            }
            return null;
        }
    }
}
