package com.checklist.validation;

/**
 * How a selection that names the same option twice is treated.
 */
public enum DuplicateOptionPolicy {
    /** Fail validation with {@code DUPLICATE_OPTION}. */
    REJECT,
    /** Accept; duplicates collapse to one option. */
    ALLOW
}
