package com.checklist.rule.expression;

/**
 * Token types for rule parsing.
 */
public enum TokenType {
    // Literals
    BOOLEAN,
    CEE_SCORE,
    DIGITS,
    QUESTION,

    // Separators
    COMMA,
    SEMI,

    // Keywords
    IF,
    THEN,

    // Logical operators
    AND,
    OR,

    // Comparison operators
    EQUAL,
    GE,
    GT,
    LE,
    LT,

    // Range, selection and percent markers
    RANGE,
    SELECTION,
    PERCENT,

    // Letters that form no keyword or literal
    WORD,

    // Special
    EOF
}
