package com.checklist.emit;

import com.checklist.config.RulesConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScoreExpressions.
 */
class ScoreExpressionsTest {

    private final ScoreExpressions expressions = new ScoreExpressions(RulesConfig.defaults());

    @Test
    @DisplayName("Integer score maps green, yellow and red to 3, 2 and 1")
    void intScore() {
        assertEquals("if(string(${Q1_SCORE}) = 'green', 3, "
                        + "if(string(${Q1_SCORE}) = 'yellow', 2, "
                        + "if(string(${Q1_SCORE}) = 'red', 1, 0)))",
                expressions.intScore("Q1_SCORE"));
    }

    @Test
    @DisplayName("Max score depends on scoring logic and the N/A option")
    void maxScore() {
        assertEquals("0", expressions.maxScore("Q1_RELEVANCE", false, true));
        assertEquals("3", expressions.maxScore("Q1_RELEVANCE", true, false));
        assertEquals("if(string(${Q1_RELEVANCE}) = 'yes', 3, 0)",
                expressions.maxScore("Q1_RELEVANCE", true, true));
    }
}
