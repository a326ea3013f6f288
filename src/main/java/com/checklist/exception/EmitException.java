package com.checklist.exception;

/**
 * Exception thrown when a rule cannot be written as a form expression.
 */
public class EmitException extends RulesException {

    public enum Kind {
        INVALID_FIELD_REF,
        NOT_A_SCORING_RULE,
        MISSING_ELSE
    }

    private final Kind kind;

    public EmitException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
