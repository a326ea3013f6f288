package com.checklist.emit;

import com.checklist.config.RulesConfig;
import com.checklist.rule.CeeScore;

import java.util.Objects;

/**
 * Calculations derived from a question's score field.
 */
public final class ScoreExpressions {

    static final int MAX_POINTS = CeeScore.GREEN.points();

    private final RulesConfig config;

    public ScoreExpressions(RulesConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Integer points for a score field: green 3, yellow 2, red 1, otherwise 0.
     */
    public String intScore(String scoreField) {
        String value = XPath.string(scoreField);
        String result = "0";
        CeeScore[] ranked = {CeeScore.RED, CeeScore.YELLOW, CeeScore.GREEN};
        for (CeeScore score : ranked) {
            result = XPath.ifThenElse(
                    XPath.binary(value, "=", XPath.text(score.choiceName())),
                    Integer.toString(score.points()),
                    result);
        }
        return result;
    }

    /**
     * Maximum points a question can contribute.
     *
     * @param relevanceField   Field holding the question's applicability answer
     * @param hasScoringLogic  Whether the question is scored at all
     * @param naOption         Whether the question can be marked not applicable
     */
    public String maxScore(String relevanceField, boolean hasScoringLogic, boolean naOption) {
        if (!hasScoringLogic) {
            return "0";
        }
        if (!naOption) {
            return Integer.toString(MAX_POINTS);
        }
        return XPath.ifThenElse(
                XPath.binary(XPath.string(relevanceField), "=", XPath.text(config.yesChoice())),
                Integer.toString(MAX_POINTS),
                "0");
    }
}
