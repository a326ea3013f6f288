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
import com.checklist.rule.condition.ComparisonJunction;
import com.checklist.rule.condition.ComparisonLeaf;
import com.checklist.rule.condition.CountCondition;
import com.checklist.rule.condition.RangeCondition;
import com.checklist.rule.condition.SelectionCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleParser.
 */
class RuleParserTest {

    // =====================================================================
    // Scoring rules
    // =====================================================================

    @Test
    @DisplayName("If Y = Green parses to a boolean scoring rule")
    void booleanScoringRule() {
        Rule rule = parse("If Y = Green");

        assertEquals(new ScoringRule(new BooleanCondition(BooleanLiteral.YES), CeeScore.GREEN), rule);
    }

    @Test
    @DisplayName("If 3 = Red parses to a count scoring rule")
    void countScoringRule() {
        Rule rule = parse("If 3 = Red");

        assertEquals(new ScoringRule(new CountCondition(3), CeeScore.RED), rule);
    }

    @Test
    @DisplayName("If >=80% = Green parses to a percent comparison")
    void percentComparisonRule() {
        Rule rule = parse("If >=80% = Green");

        assertEquals(new ScoringRule(
                new ComparisonCondition(new ComparisonLeaf(Comparator.GE, 80, true)),
                CeeScore.GREEN), rule);
    }

    @Test
    @DisplayName("If 3-5 = Yellow parses to a range rule")
    void rangeRule() {
        Rule rule = parse("If 3-5 = Yellow");

        assertEquals(new ScoringRule(new RangeCondition(3, 5), CeeScore.YELLOW), rule);
    }

    @Test
    @DisplayName("If #2 or #3 = Red parses to a selection rule")
    void selectionRule() {
        Rule rule = parse("If #2 or #3 = Red");

        assertEquals(new ScoringRule(new SelectionCondition(List.of(2, 3)), CeeScore.RED), rule);
    }

    @ParameterizedTest
    @DisplayName("Target score equals the literal in the text")
    @CsvSource({
            "If Y = Gray, GRAY",
            "If N = Green, GREEN",
            "If 0 = Red, RED",
            "If <5 = Yellow, YELLOW",
            "If 1-2 = Green, GREEN",
            "If #1 = Red, RED",
            "if >10% = Red, RED"
    })
    void targetMatchesLiteral(String text, CeeScore expected) {
        ScoringRule rule = (ScoringRule) parse(text);

        assertEquals(expected, rule.target());
    }

    // =====================================================================
    // Skip rules
    // =====================================================================

    @Test
    @DisplayName("If N, then Q5 parses to a boolean skip rule")
    void booleanSkipRule() {
        Rule rule = parse("If N, then Q5");

        assertEquals(new SkipRule(new BooleanCondition(BooleanLiteral.NO), new QuestionRef(5)), rule);
    }

    @Test
    @DisplayName("If 2, then Q12 parses to a count skip rule")
    void countSkipRule() {
        Rule rule = parse("If 2, then Q12");

        assertEquals(new SkipRule(new CountCondition(2), new QuestionRef(12)), rule);
    }

    @Test
    @DisplayName("If >3, then Q7 parses to a comparison skip rule")
    void comparisonSkipRule() {
        Rule rule = parse("If >3, then Q7");

        assertEquals(new SkipRule(
                new ComparisonCondition(new ComparisonLeaf(Comparator.GT, 3, false)),
                new QuestionRef(7)), rule);
    }

    // =====================================================================
    // Compound expressions
    // =====================================================================

    @Test
    @DisplayName("Percent applies only to the leaf that carries it")
    void percentIsPerLeaf() {
        ComparisonCondition condition = (ComparisonCondition) parse("If >5% and =<10 = Yellow").condition();

        assertEquals(new ComparisonJunction(LogicalOperator.AND,
                new ComparisonLeaf(Comparator.GT, 5, true),
                new ComparisonLeaf(Comparator.LE, 10, false)), condition.expression());
    }

    @Test
    @DisplayName("Mixed and/or fold left to right at one precedence level")
    void mixedOperatorsFoldLeft() {
        ComparisonCondition condition = (ComparisonCondition) parse("If <2 or >8 and <10 = Red").condition();

        ComparisonJunction expected = new ComparisonJunction(LogicalOperator.AND,
                new ComparisonJunction(LogicalOperator.OR,
                        new ComparisonLeaf(Comparator.LT, 2, false),
                        new ComparisonLeaf(Comparator.GT, 8, false)),
                new ComparisonLeaf(Comparator.LT, 10, false));
        assertEquals(expected, condition.expression());
    }

    @Test
    @DisplayName("Unicode comparison aliases parse like their ASCII forms")
    void unicodeAliases() {
        assertEquals(parse("If >=50% = Green"), parse("If ≥50% = Green"));
        assertEquals(parse("If =<50% = Red"), parse("If ≤50% = Red"));
    }

    @Test
    @DisplayName("Selection keeps options in source order, duplicates included")
    void selectionKeepsDuplicates() {
        SelectionCondition condition = (SelectionCondition) parse("If #3 or #1 or #3 = Green").condition();

        assertEquals(List.of(3, 1, 3), condition.options());
    }

    // =====================================================================
    // Errors
    // =====================================================================

    @Test
    @DisplayName("If foo = Green fails at the position of foo")
    void unknownWord() {
        RuleParseException e = assertThrows(RuleParseException.class, () -> parse("If foo = Green"));

        assertEquals(RuleParseException.Kind.UNEXPECTED_TOKEN, e.getKind());
        assertEquals(3, e.getPosition());
        assertEquals("foo", e.getFound());
        assertTrue(e.getExpected().contains("BOOLEAN"));
        assertTrue(e.getExpected().contains("SELECTION"));
    }

    @ParameterizedTest
    @DisplayName("A stray token after a complete rule is trailing input")
    @CsvSource({
            "'If Y = Green Red'",
            "'If N, then Q5 Q6'",
            "'If 3-5 = Yellow 7'",
            "'If #2 or #3 = Red #'",
            "'If >=80% = Green %'",
            "'If Y = Green; If N = Red'"
    })
    void trailingInput(String text) {
        RuleParseException e = assertThrows(RuleParseException.class, () -> parse(text));

        assertEquals(RuleParseException.Kind.TRAILING_INPUT, e.getKind());
    }

    @ParameterizedTest
    @DisplayName("Input ending mid-rule is unterminated")
    @CsvSource({
            "''",
            "'If'",
            "'If Y ='",
            "'If >=80% and'",
            "'If 3-'",
            "'If N, then'"
    })
    void unterminated(String text) {
        RuleParseException e = assertThrows(RuleParseException.class, () -> parse(text));

        assertEquals(RuleParseException.Kind.UNTERMINATED, e.getKind());
        assertEquals(text.length(), e.getPosition());
    }

    @Test
    @DisplayName("Rule must start with If")
    void missingIf() {
        RuleParseException e = assertThrows(RuleParseException.class, () -> parse("Y = Green"));

        assertEquals(0, e.getPosition());
        assertEquals(Set.of("IF"), e.getExpected());
    }

    @Test
    @DisplayName("Range and selection rules cannot be skip rules")
    void rangeAndSelectionCannotSkip() {
        RuleParseException range = assertThrows(RuleParseException.class, () -> parse("If 3-5, then Q2"));
        assertEquals(RuleParseException.Kind.UNEXPECTED_TOKEN, range.getKind());
        assertEquals(Set.of("EQUAL"), range.getExpected());

        RuleParseException selection = assertThrows(RuleParseException.class, () -> parse("If #1, then Q2"));
        assertEquals(Set.of("EQUAL"), selection.getExpected());
    }

    @Test
    @DisplayName("Selections only combine with or")
    void selectionRejectsAnd() {
        RuleParseException e = assertThrows(RuleParseException.class, () -> parse("If #1 and #2 = Red"));

        assertEquals(6, e.getPosition());
        assertEquals("and", e.getFound());
    }

    @Test
    @DisplayName("Skip rule target must be a question reference")
    void skipTargetMustBeQuestion() {
        RuleParseException e = assertThrows(RuleParseException.class, () -> parse("If Y, then Green"));

        assertEquals(Set.of("QUESTION"), e.getExpected());
    }

    // =====================================================================
    // Multiple rules
    // =====================================================================

    @Test
    @DisplayName("parseAll reads semicolon-separated rules")
    void parseAllReadsRules() {
        String text = "If >10% = Red ; If >5% and =<10% = Yellow; If <5% = Green;";
        List<Rule> rules = new RuleParser(text, new RuleTokenizer(text).tokenize()).parseAll();

        assertEquals(3, rules.size());
        assertEquals(CeeScore.RED, ((ScoringRule) rules.get(0)).target());
        assertEquals(CeeScore.YELLOW, ((ScoringRule) rules.get(1)).target());
        assertEquals(CeeScore.GREEN, ((ScoringRule) rules.get(2)).target());
    }

    @Test
    @DisplayName("parseAll rejects empty rules between separators")
    void parseAllRejectsEmptyRule() {
        String text = "If Y = Green;; If N = Red";

        assertThrows(RuleParseException.class,
                () -> new RuleParser(text, new RuleTokenizer(text).tokenize()).parseAll());
    }

    private static Rule parse(String text) {
        return new RuleParser(text, new RuleTokenizer(text).tokenize()).parse();
    }
}
