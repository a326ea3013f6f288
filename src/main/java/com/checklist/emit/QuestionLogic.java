package com.checklist.emit;

/**
 * A question's field name together with its raw scoring-logic cell.
 *
 * @param field        Question field name
 * @param scoringLogic Semicolon-separated scoring rules, may be blank
 */
public record QuestionLogic(String field, String scoringLogic) {

    public boolean hasScoringLogic() {
        return scoringLogic != null && !scoringLogic.isBlank();
    }
}
