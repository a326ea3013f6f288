package com.checklist.exception;

/**
 * Exception thrown when a parsed rule breaks an invariant the grammar cannot express.
 */
public class RuleValidationException extends RulesException {

    public enum Kind {
        INVERTED_RANGE,
        EMPTY_SELECTION,
        DUPLICATE_OPTION,
        INVALID_OPTION,
        PERCENT_OUT_OF_RANGE
    }

    private final Kind kind;

    public RuleValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
