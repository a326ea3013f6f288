package com.checklist.rule.expression;

/**
 * Represents a token in a rule.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Parsed literal value (numbers, booleans, scores, question numbers)
 * @param position Position in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
