package com.checklist.emit;

import com.checklist.rule.Rule;
import com.checklist.rule.ScoringRule;
import com.checklist.rule.SkipRule;
import com.checklist.rule.condition.BooleanCondition;
import com.checklist.rule.condition.ComparisonCondition;
import com.checklist.rule.condition.ComparisonExpression;
import com.checklist.rule.condition.ComparisonJunction;
import com.checklist.rule.condition.ComparisonLeaf;
import com.checklist.rule.condition.ConditionVisitor;
import com.checklist.rule.condition.CountCondition;
import com.checklist.rule.condition.RangeCondition;
import com.checklist.rule.condition.SelectionCondition;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes rules back as canonical rule text, e.g. {@code If >=80% = Green}.
 * Parsing the output yields an equal rule. An empty selection has no text
 * form and is rejected.
 */
public final class RuleRenderer {

    private static final ConditionVisitor<String> CONDITION_TEXT = new ConditionText();

    private RuleRenderer() {
    }

    public static String render(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        String condition = rule.condition().accept(CONDITION_TEXT);
        if (rule instanceof ScoringRule scoring) {
            return "If " + condition + " = " + scoring.target().label();
        }
        SkipRule skip = (SkipRule) rule;
        return "If " + condition + ", then " + skip.targetQuestion();
    }

    private static final class ConditionText implements ConditionVisitor<String> {

        @Override
        public String visitBoolean(BooleanCondition condition) {
            return condition.value().symbol();
        }

        @Override
        public String visitCount(CountCondition condition) {
            return Integer.toString(condition.count());
        }

        @Override
        public String visitComparison(ComparisonCondition condition) {
            return write(condition.expression());
        }

        @Override
        public String visitRange(RangeCondition condition) {
            return condition.low() + "-" + condition.high();
        }

        @Override
        public String visitSelection(SelectionCondition condition) {
            if (condition.options().isEmpty()) {
                throw new IllegalArgumentException("Cannot render a selection without options");
            }
            return condition.options().stream()
                    .map(option -> "#" + option)
                    .collect(Collectors.joining(" or "));
        }

        private String write(ComparisonExpression expression) {
            if (expression instanceof ComparisonLeaf leaf) {
                return leaf.comparator().symbol() + leaf.threshold() + (leaf.percent() ? "%" : "");
            }
            ComparisonJunction junction = (ComparisonJunction) expression;
            return write(junction.left()) + " " + junction.operator().keyword() + " " + write(junction.right());
        }
    }
}
