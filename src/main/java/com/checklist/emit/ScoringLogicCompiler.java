package com.checklist.emit;

import com.checklist.exception.EmitException;
import com.checklist.rule.Rule;
import com.checklist.rule.ScoringRule;
import com.checklist.rule.expression.RuleParser;
import com.checklist.rule.expression.RuleTokenizer;
import com.checklist.validation.RuleValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiles semicolon-separated scoring rules into one nested
 * {@code if(...)} score calculation.
 * <p>
 * Rules are tried in order. Without an else expression the last rule acts
 * as the fallback, so only its score is used:
 * <pre>
 * If &gt;10% = Red; If &gt;5% and =&lt;10% = Yellow; If &lt;5% = Green
 *   -&gt; if(number(${q}) &gt; 10, 'red', if(number(${q}) &gt; 5 and number(${q}) &lt;= 10, 'yellow', 'green'))
 * </pre>
 */
public final class ScoringLogicCompiler {

    private final RuleValidator validator;
    private final RuleEmitter emitter;

    public ScoringLogicCompiler(RuleValidator validator, RuleEmitter emitter) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    /**
     * Compile one question's scoring logic.
     *
     * @param field          Question field name
     * @param scoringLogic   Semicolon-separated scoring rules
     * @param elseExpression Expression used when no rule matches, or null to
     *                       use the last rule's score
     * @return Score calculation
     */
    public String compile(String field, String scoringLogic, String elseExpression) {
        Objects.requireNonNull(scoringLogic, "scoringLogic");
        emitter.checkFieldRef(field);

        List<ScoringRule> rules = parseScoringRules(field, scoringLogic);
        if (elseExpression == null && rules.size() < 2) {
            throw new EmitException(EmitException.Kind.MISSING_ELSE,
                    "Question '" + field + "' has a single scoring rule and no else expression");
        }

        List<ScoringRule> branches = elseExpression != null ? rules : rules.subList(0, rules.size() - 1);
        String result = elseExpression != null
                ? elseExpression
                : XPath.text(rules.get(rules.size() - 1).target().choiceName());

        for (int i = branches.size() - 1; i >= 0; i--) {
            ScoringRule rule = branches.get(i);
            result = XPath.ifThenElse(emitter.emitCondition(rule, field),
                    XPath.text(rule.target().choiceName()), result);
        }
        return result;
    }

    /**
     * Compile a section. Each question's chain falls through to the chain of
     * the question after it; questions without scoring logic are skipped.
     *
     * @param questions Questions in section order
     * @return Section score calculation, empty if no question has scoring logic
     */
    public Optional<String> compileSection(List<QuestionLogic> questions) {
        Objects.requireNonNull(questions, "questions");
        String result = null;
        for (int i = questions.size() - 1; i >= 0; i--) {
            QuestionLogic question = questions.get(i);
            if (question.hasScoringLogic()) {
                result = compile(question.field(), question.scoringLogic(), result);
            }
        }
        return Optional.ofNullable(result);
    }

    private List<ScoringRule> parseScoringRules(String field, String scoringLogic) {
        List<Rule> parsed = new RuleParser(scoringLogic, new RuleTokenizer(scoringLogic).tokenize()).parseAll();
        List<ScoringRule> rules = new ArrayList<>(parsed.size());
        for (Rule rule : parsed) {
            if (!(rule instanceof ScoringRule scoring)) {
                throw new EmitException(EmitException.Kind.NOT_A_SCORING_RULE,
                        "Question '" + field + "' scoring logic contains a skip rule: " + RuleRenderer.render(rule));
            }
            validator.validate(scoring);
            rules.add(scoring);
        }
        return rules;
    }
}
