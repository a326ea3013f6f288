package com.checklist.rule;

import java.util.Arrays;
import java.util.Optional;

/**
 * Outcome categories a scoring rule can assign.
 */
public enum CeeScore {
    GRAY("Gray", "gray", 0),
    GREEN("Green", "green", 3),
    RED("Red", "red", 1),
    YELLOW("Yellow", "yellow", 2);

    private final String label;
    private final String choiceName;
    private final int points;

    CeeScore(String label, String choiceName, int points) {
        this.label = label;
        this.choiceName = choiceName;
        this.points = points;
    }

    /**
     * Spelling used in rule text, e.g. {@code Green}.
     */
    public String label() {
        return label;
    }

    /**
     * XLSForm choice name, e.g. {@code green}.
     */
    public String choiceName() {
        return choiceName;
    }

    /**
     * Integer score used by the section totals.
     */
    public int points() {
        return points;
    }

    /**
     * Case-sensitive lookup by rule-text label.
     */
    public static Optional<CeeScore> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(score -> score.label.equals(label))
                .findFirst();
    }
}
