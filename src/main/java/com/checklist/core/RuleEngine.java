package com.checklist.core;

import com.checklist.config.RulesConfig;
import com.checklist.emit.RuleEmitter;
import com.checklist.emit.RuleRenderer;
import com.checklist.emit.ScoreExpressions;
import com.checklist.emit.ScoringLogicCompiler;
import com.checklist.rule.Rule;
import com.checklist.rule.expression.RuleParser;
import com.checklist.rule.expression.RuleTokenizer;
import com.checklist.rule.expression.Token;
import com.checklist.validation.RuleValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point for parsing rule text and emitting form expressions.
 * Instances are immutable and safe to share between threads.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RulesConfig config;
    private final RuleValidator validator;
    private final RuleEmitter emitter;
    private final ScoringLogicCompiler scoringLogicCompiler;
    private final ScoreExpressions scoreExpressions;

    public RuleEngine(RulesConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.validator = new RuleValidator(config.duplicateOptions());
        this.emitter = new RuleEmitter(config);
        this.scoringLogicCompiler = new ScoringLogicCompiler(validator, emitter);
        this.scoreExpressions = new ScoreExpressions(config);
    }

    public static RuleEngine withDefaults() {
        return new RuleEngine(RulesConfig.defaults());
    }

    /**
     * Tokenize, parse and validate one rule.
     *
     * @param text Rule text such as {@code If 3-5 = Yellow}
     * @return Validated rule
     * @throws com.checklist.exception.LexException            on a character no token starts with
     * @throws com.checklist.exception.RuleParseException      on a grammar violation
     * @throws com.checklist.exception.RuleValidationException on a broken invariant
     */
    public Rule parseRule(String text) {
        Objects.requireNonNull(text, "text");
        List<Token> tokens = new RuleTokenizer(text).tokenize();
        Rule rule = new RuleParser(text, tokens).parse();
        validator.validate(rule);
        log.debug("Parsed '{}' into {}", text, rule);
        return rule;
    }

    /**
     * Emit the form expression for a validated rule bound to {@code field}.
     *
     * @throws com.checklist.exception.EmitException if {@code field} is not a legal field reference
     */
    public String emitExpression(Rule rule, String field) {
        String expression = emitter.emit(rule, field);
        log.debug("Emitted {} for field {}: {}", rule, field, expression);
        return expression;
    }

    public String render(Rule rule) {
        return RuleRenderer.render(rule);
    }

    /**
     * Compile a semicolon-separated scoring-logic cell into a nested score calculation.
     *
     * @see ScoringLogicCompiler#compile(String, String, String)
     */
    public String compileScoringLogic(String field, String scoringLogic, String elseExpression) {
        return scoringLogicCompiler.compile(field, scoringLogic, elseExpression);
    }

    public RulesConfig getConfig() {
        return config;
    }

    public RuleEmitter getEmitter() {
        return emitter;
    }

    public ScoringLogicCompiler getScoringLogicCompiler() {
        return scoringLogicCompiler;
    }

    public ScoreExpressions getScoreExpressions() {
        return scoreExpressions;
    }
}
