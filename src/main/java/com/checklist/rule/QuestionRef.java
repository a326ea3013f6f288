package com.checklist.rule;

/**
 * Reference to a checklist question, written {@code Q<number>}.
 *
 * @param number Question number
 */
public record QuestionRef(int number) {

    public QuestionRef {
        if (number < 0) {
            throw new IllegalArgumentException("Question number must not be negative: " + number);
        }
    }

    @Override
    public String toString() {
        return "Q" + number;
    }
}
