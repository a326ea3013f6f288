package com.checklist.rule.expression;

import java.util.Map;

/**
 * Keywords and operator symbols of the rule language.
 */
public final class RuleSyntax {

    private RuleSyntax() {
    }

    /**
     * Words mapped to token types. Matching is case-sensitive.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("If", TokenType.IF),
            Map.entry("if", TokenType.IF),
            Map.entry("then", TokenType.THEN),

            // Logical
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),

            // Literals
            Map.entry("Y", TokenType.BOOLEAN),
            Map.entry("N", TokenType.BOOLEAN),
            Map.entry("Gray", TokenType.CEE_SCORE),
            Map.entry("Green", TokenType.CEE_SCORE),
            Map.entry("Red", TokenType.CEE_SCORE),
            Map.entry("Yellow", TokenType.CEE_SCORE)
    );

    /**
     * Letter that starts a question reference such as {@code Q5}.
     */
    public static final char QUESTION_PREFIX = 'Q';

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char COMMA = ',';
        public static final char SEMI = ';';
        public static final char EQUALS = '=';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char GREATER_OR_EQUAL = '≥';
        public static final char LESS_OR_EQUAL = '≤';
        public static final char MINUS = '-';
        public static final char HASH = '#';
        public static final char PERCENT = '%';

        private Operators() {
        }
    }
}
