package com.checklist.emit;

/**
 * How a percentage threshold is written in the emitted expression.
 */
public enum PercentMode {
    /** {@code 80%} is written as {@code 80}. */
    WHOLE,
    /** {@code 80%} is written as {@code 0.8}. */
    FRACTION
}
