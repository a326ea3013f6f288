package com.checklist.exception;

/**
 * Exception thrown when rule text contains a character no token starts with.
 */
public class LexException extends RulesException {

    private final int position;
    private final char unexpectedChar;

    public LexException(String input, int position, char unexpectedChar) {
        this("Unexpected character '" + unexpectedChar + "'", input, position, unexpectedChar);
    }

    public LexException(String detail, String input, int position, char unexpectedChar) {
        super("Invalid rule at position " + position + ": " + detail + " in '" + input + "'");
        this.position = position;
        this.unexpectedChar = unexpectedChar;
    }

    public int getPosition() {
        return position;
    }

    public char getUnexpectedChar() {
        return unexpectedChar;
    }
}
