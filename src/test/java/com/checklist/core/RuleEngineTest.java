package com.checklist.core;

import com.checklist.exception.LexException;
import com.checklist.exception.RuleParseException;
import com.checklist.exception.RuleValidationException;
import com.checklist.exception.RulesException;
import com.checklist.rule.BooleanLiteral;
import com.checklist.rule.CeeScore;
import com.checklist.rule.QuestionRef;
import com.checklist.rule.Rule;
import com.checklist.rule.ScoringRule;
import com.checklist.rule.SkipRule;
import com.checklist.rule.condition.BooleanCondition;
import com.checklist.rule.condition.RangeCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for RuleEngine.
 */
class RuleEngineTest {

    private final RuleEngine engine = RuleEngine.withDefaults();

    @Test
    @DisplayName("Parses a scoring rule")
    void parsesScoringRule() {
        Rule rule = engine.parseRule("If Y = Green");

        assertEquals(new ScoringRule(new BooleanCondition(BooleanLiteral.YES), CeeScore.GREEN), rule);
    }

    @Test
    @DisplayName("Parses a skip rule")
    void parsesSkipRule() {
        Rule rule = engine.parseRule("If N, then Q5");

        assertEquals(new SkipRule(new BooleanCondition(BooleanLiteral.NO), new QuestionRef(5)), rule);
    }

    @Test
    @DisplayName("Parses and emits a range rule")
    void rangeRule() {
        Rule rule = engine.parseRule("If 3-5 = Yellow");

        assertEquals(new ScoringRule(new RangeCondition(3, 5), CeeScore.YELLOW), rule);
        assertEquals("if(count-selected(${Q7}) >= 3 and count-selected(${Q7}) <= 5, 'yellow', 'gray')",
                engine.emitExpression(rule, "Q7"));
    }

    @Test
    @DisplayName("Rendering a parsed rule gives canonical text")
    void rendersCanonically() {
        assertEquals("If >=80% = Green", engine.render(engine.parseRule("If ≥ 80 % = Green")));
    }

    @Test
    @DisplayName("Out of range percentages fail validation")
    void percentOutOfRange() {
        RuleValidationException e = assertThrows(RuleValidationException.class,
                () -> engine.parseRule("If >120% = Red"));

        assertEquals(RuleValidationException.Kind.PERCENT_OUT_OF_RANGE, e.getKind());
    }

    @Test
    @DisplayName("Unknown words fail parsing at their position")
    void unknownWord() {
        RuleParseException e = assertThrows(RuleParseException.class, () -> engine.parseRule("If foo = Green"));

        assertEquals(3, e.getPosition());
    }

    @Test
    @DisplayName("Stray characters fail lexing")
    void strayCharacter() {
        LexException e = assertThrows(LexException.class, () -> engine.parseRule("If Y = Green!"));

        assertEquals('!', e.getUnexpectedChar());
    }

    @ParameterizedTest
    @DisplayName("Blank text is unterminated")
    @ValueSource(strings = {"", "   "})
    void blankText(String text) {
        RuleParseException e = assertThrows(RuleParseException.class, () -> engine.parseRule(text));

        assertEquals(RuleParseException.Kind.UNTERMINATED, e.getKind());
    }

    @Test
    @DisplayName("All rule failures share one base exception")
    void failuresShareBaseType() {
        assertThrows(RulesException.class, () -> engine.parseRule("If #0 = Red"));
        assertThrows(RulesException.class, () -> engine.parseRule("If Y"));
        assertThrows(RulesException.class, () -> engine.parseRule("If Y = Green $"));
    }

    @Test
    @DisplayName("Compiles scoring logic and score calculations")
    void scoringLogic() {
        assertEquals("if(selected(${Q1}, 'Q1_1'), 'green', 'red')",
                engine.compileScoringLogic("Q1", "If #1 = Green; If #2 = Red", null));
        assertEquals("if(string(${Q1_SCORE}) = 'green', 3, if(string(${Q1_SCORE}) = 'yellow', 2, "
                        + "if(string(${Q1_SCORE}) = 'red', 1, 0)))",
                engine.getScoreExpressions().intScore("Q1_SCORE"));
    }
}
