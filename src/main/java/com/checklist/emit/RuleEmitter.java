package com.checklist.emit;

import com.checklist.config.RulesConfig;
import com.checklist.exception.EmitException;
import com.checklist.rule.BooleanLiteral;
import com.checklist.rule.Comparator;
import com.checklist.rule.LogicalOperator;
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

import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes validated rules as XLSForm XPath expressions bound to a question field.
 * <p>
 * Skip rules become the target question's {@code relevant} expression.
 * Scoring rules become a {@code calculation} of the form
 * {@code if(<condition>, '<score>', '<default score>')}.
 */
public final class RuleEmitter {

    private final RulesConfig config;
    private final Pattern fieldRefPattern;

    public RuleEmitter(RulesConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.fieldRefPattern = Pattern.compile(config.fieldRefPattern());
    }

    /**
     * Emit the full expression for a rule.
     *
     * @param rule  Validated rule
     * @param field Name of the question the condition reads
     * @return Relevance expression for skip rules, score calculation for scoring rules
     */
    public String emit(Rule rule, String field) {
        String condition = emitCondition(rule, field);
        if (rule instanceof ScoringRule scoring) {
            return XPath.ifThenElse(condition,
                    XPath.text(scoring.target().choiceName()),
                    XPath.text(config.defaultScore().choiceName()));
        }
        return condition;
    }

    /**
     * Emit only the boolean condition of a rule.
     */
    public String emitCondition(Rule rule, String field) {
        Objects.requireNonNull(rule, "rule");
        checkFieldRef(field);
        return rule.condition().accept(new ConditionWriter(field, rule instanceof SkipRule));
    }

    /**
     * Choice name of the {@code index}-th option of {@code field}.
     */
    public String optionName(String field, int index) {
        return config.optionNameFormat()
                .replace(RulesConfig.QUESTION_PLACEHOLDER, field)
                .replace(RulesConfig.INDEX_PLACEHOLDER, Integer.toString(index));
    }

    void checkFieldRef(String field) {
        if (field == null || !fieldRefPattern.matcher(field).matches()) {
            throw new EmitException(EmitException.Kind.INVALID_FIELD_REF,
                    "Invalid field reference '" + field + "', expected to match " + config.fieldRefPattern());
        }
    }

    private final class ConditionWriter implements ConditionVisitor<String> {

        private final String field;
        private final boolean relevance;

        ConditionWriter(String field, boolean relevance) {
            this.field = field;
            this.relevance = relevance;
        }

        @Override
        public String visitBoolean(BooleanCondition condition) {
            if (relevance) {
                return XPath.selected(field, choiceFor(condition.value() == BooleanLiteral.YES));
            }
            // Scores read "not selected the opposite answer"; ODK handles an
            // unanswered question better in this form.
            return XPath.not(XPath.selected(field, choiceFor(condition.value() != BooleanLiteral.YES)));
        }

        @Override
        public String visitCount(CountCondition condition) {
            return XPath.binary(XPath.countSelected(field), "=", Integer.toString(condition.count()));
        }

        @Override
        public String visitComparison(ComparisonCondition condition) {
            return writeComparison(condition.expression());
        }

        @Override
        public String visitRange(RangeCondition condition) {
            String count = XPath.countSelected(field);
            return XPath.binary(
                    XPath.binary(count, Comparator.GE.xpathSymbol(), Integer.toString(condition.low())),
                    LogicalOperator.AND.keyword(),
                    XPath.binary(count, Comparator.LE.xpathSymbol(), Integer.toString(condition.high())));
        }

        @Override
        public String visitSelection(SelectionCondition condition) {
            return condition.distinctOptions().stream()
                    .map(option -> XPath.selected(field, optionName(field, option)))
                    .collect(Collectors.joining(" " + LogicalOperator.OR.keyword() + " "));
        }

        private String writeComparison(ComparisonExpression expression) {
            if (expression instanceof ComparisonLeaf leaf) {
                String operand = leaf.percent() ? XPath.number(field) : XPath.countSelected(field);
                return XPath.binary(operand, leaf.comparator().xpathSymbol(), threshold(leaf));
            }
            ComparisonJunction junction = (ComparisonJunction) expression;
            String left = writeComparison(junction.left());
            // XPath binds 'and' tighter than 'or'; keep the left-to-right grouping
            if (junction.left() instanceof ComparisonJunction inner && inner.operator() != junction.operator()) {
                left = XPath.group(left);
            }
            return XPath.binary(left, junction.operator().keyword(), writeComparison(junction.right()));
        }

        private String threshold(ComparisonLeaf leaf) {
            if (leaf.percent() && config.percentMode() == PercentMode.FRACTION) {
                return BigDecimal.valueOf(leaf.threshold()).movePointLeft(2).stripTrailingZeros().toPlainString();
            }
            return Integer.toString(leaf.threshold());
        }

        private String choiceFor(boolean yes) {
            return yes ? config.yesChoice() : config.noChoice();
        }
    }
}
