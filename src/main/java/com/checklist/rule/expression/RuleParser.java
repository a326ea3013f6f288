package com.checklist.rule.expression;

import com.checklist.exception.RuleParseException;
import com.checklist.rule.BooleanLiteral;
import com.checklist.rule.CeeScore;
import com.checklist.rule.Comparator;
import com.checklist.rule.LogicalOperator;
import com.checklist.rule.QuestionRef;
import com.checklist.rule.Rule;
import com.checklist.rule.ScoringRule;
import com.checklist.rule.SkipRule;
import com.checklist.rule.condition.BooleanCondition;
import com.checklist.rule.condition.ComparisonCondition;
import com.checklist.rule.condition.ComparisonExpression;
import com.checklist.rule.condition.ComparisonJunction;
import com.checklist.rule.condition.ComparisonLeaf;
import com.checklist.rule.condition.Condition;
import com.checklist.rule.condition.CountCondition;
import com.checklist.rule.condition.RangeCondition;
import com.checklist.rule.condition.SelectionCondition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parser for scoring and skip rules.
 * Converts tokens into a {@link Rule} using recursive descent with one token of lookahead.
 * <p>
 * Grammar:
 * <pre>
 * rules      := rule (';' rule)* ';'?
 * rule       := IF body
 * body       := BOOLEAN outcome
 *             | DIGITS '-' DIGITS '=' CEE_SCORE
 *             | DIGITS outcome
 *             | comparison outcome
 *             | selection '=' CEE_SCORE
 * outcome    := '=' CEE_SCORE | ',' THEN QUESTION
 * comparison := atom (('and' | 'or') atom)*
 * atom       := ('>=' | '>' | '=<' | '<') DIGITS '%'?
 * selection  := '#' DIGITS ('or' '#' DIGITS)*
 * </pre>
 * {@code and} and {@code or} share one precedence level and group left to right.
 */
public final class RuleParser {

    private static final TokenType[] COMPARATORS = {TokenType.GE, TokenType.GT, TokenType.LE, TokenType.LT};

    private final String input;
    private final List<Token> tokens;
    private int index;

    public RuleParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse exactly one rule.
     *
     * @return Scoring or skip rule
     */
    public Rule parse() {
        Rule rule = parseRule();
        expectEnd();
        return rule;
    }

    /**
     * Parse one or more rules separated by semicolons, as found in a
     * scoring-logic cell. A single trailing semicolon is allowed.
     *
     * @return Rules in source order
     */
    public List<Rule> parseAll() {
        List<Rule> rules = new ArrayList<>();
        rules.add(parseRule());
        while (match(TokenType.SEMI)) {
            if (isAtEnd()) {
                break;
            }
            rules.add(parseRule());
        }
        expectEnd();
        return rules;
    }

    private Rule parseRule() {
        consume(TokenType.IF);

        if (match(TokenType.BOOLEAN)) {
            BooleanLiteral value = (BooleanLiteral) previous().literal();
            return parseOutcome(new BooleanCondition(value));
        }

        if (check(TokenType.DIGITS)) {
            if (checkNext(TokenType.RANGE)) {
                return parseRange();
            }
            int count = (int) advance().literal();
            return parseOutcome(new CountCondition(count));
        }

        if (check(COMPARATORS)) {
            return parseOutcome(new ComparisonCondition(parseComparison()));
        }

        if (check(TokenType.SELECTION)) {
            SelectionCondition selection = parseSelection();
            consume(TokenType.EQUAL);
            return new ScoringRule(selection, parseScore());
        }

        throw error(TokenType.BOOLEAN, TokenType.DIGITS, TokenType.GE, TokenType.GT,
                TokenType.LE, TokenType.LT, TokenType.SELECTION);
    }

    private Rule parseOutcome(Condition condition) {
        if (match(TokenType.EQUAL)) {
            return new ScoringRule(condition, parseScore());
        }
        if (match(TokenType.COMMA)) {
            consume(TokenType.THEN);
            Token question = consume(TokenType.QUESTION);
            return new SkipRule(condition, new QuestionRef((int) question.literal()));
        }
        throw error(TokenType.EQUAL, TokenType.COMMA);
    }

    private Rule parseRange() {
        int low = (int) consume(TokenType.DIGITS).literal();
        consume(TokenType.RANGE);
        int high = (int) consume(TokenType.DIGITS).literal();
        consume(TokenType.EQUAL);
        return new ScoringRule(new RangeCondition(low, high), parseScore());
    }

    private ComparisonExpression parseComparison() {
        ComparisonExpression left = parseComparisonAtom();

        while (check(TokenType.AND, TokenType.OR)) {
            LogicalOperator operator = advance().type() == TokenType.AND ? LogicalOperator.AND : LogicalOperator.OR;
            ComparisonExpression right = parseComparisonAtom();
            left = new ComparisonJunction(operator, left, right);
        }

        return left;
    }

    private ComparisonLeaf parseComparisonAtom() {
        if (!check(COMPARATORS)) {
            throw error(COMPARATORS);
        }
        Comparator comparator = switch (advance().type()) {
            case GE -> Comparator.GE;
            case GT -> Comparator.GT;
            case LE -> Comparator.LE;
            default -> Comparator.LT;
        };
        int threshold = (int) consume(TokenType.DIGITS).literal();
        boolean percent = match(TokenType.PERCENT);
        return new ComparisonLeaf(comparator, threshold, percent);
    }

    private SelectionCondition parseSelection() {
        List<Integer> options = new ArrayList<>();
        options.add(parseSelectionAtom());

        while (match(TokenType.OR)) {
            options.add(parseSelectionAtom());
        }

        return new SelectionCondition(options);
    }

    private int parseSelectionAtom() {
        consume(TokenType.SELECTION);
        return (int) consume(TokenType.DIGITS).literal();
    }

    private CeeScore parseScore() {
        return (CeeScore) consume(TokenType.CEE_SCORE).literal();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type) {
        if (check(type)) {
            return advance();
        }
        throw error(type);
    }

    private void expectEnd() {
        if (!isAtEnd()) {
            Token token = peek();
            throw new RuleParseException(RuleParseException.Kind.TRAILING_INPUT, input,
                    token.position(), Set.of(), token.text());
        }
    }

    private boolean check(TokenType... types) {
        TokenType current = peek().type();
        for (TokenType type : types) {
            if (current == type) {
                return true;
            }
        }
        return false;
    }

    private boolean checkNext(TokenType type) {
        return index + 1 < tokens.size() && tokens.get(index + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private RuleParseException error(TokenType... expected) {
        Token token = peek();
        Set<String> expectedNames = new LinkedHashSet<>();
        Arrays.stream(expected).map(TokenType::name).forEach(expectedNames::add);
        RuleParseException.Kind kind = isAtEnd()
                ? RuleParseException.Kind.UNTERMINATED
                : RuleParseException.Kind.UNEXPECTED_TOKEN;
        return new RuleParseException(kind, input, token.position(), expectedNames, token.text());
    }
}
