package com.checklist.exception;

import java.util.Set;

/**
 * Exception thrown when a token stream does not form a rule.
 */
public class RuleParseException extends RulesException {

    /**
     * What went wrong at {@link #getPosition()}.
     */
    public enum Kind {
        UNEXPECTED_TOKEN,
        TRAILING_INPUT,
        UNTERMINATED
    }

    private final Kind kind;
    private final int position;
    private final Set<String> expected;
    private final String found;

    public RuleParseException(Kind kind, String input, int position, Set<String> expected, String found) {
        super(buildMessage(kind, input, position, expected, found));
        this.kind = kind;
        this.position = position;
        this.expected = Set.copyOf(expected);
        this.found = found;
    }

    public Kind getKind() {
        return kind;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Token kinds that would have been accepted, empty for trailing input.
     */
    public Set<String> getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    private static String buildMessage(Kind kind, String input, int position,
                                       Set<String> expected, String found) {
        String detail = switch (kind) {
            case TRAILING_INPUT -> "trailing input '" + found + "'";
            case UNTERMINATED -> "unterminated expression, expected one of " + expected;
            case UNEXPECTED_TOKEN -> "expected one of " + expected + " but found '" + found + "'";
        };
        return "Invalid rule at position " + position + ": " + detail + " in '" + input + "'";
    }
}
