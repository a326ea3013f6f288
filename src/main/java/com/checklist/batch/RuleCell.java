package com.checklist.batch;

/**
 * One spreadsheet cell holding rule text.
 *
 * @param sheet  Worksheet name
 * @param row    1-based row number
 * @param column Column header or letter
 * @param field  Question field the rule binds to
 * @param text   Raw rule text
 */
public record RuleCell(String sheet, int row, String column, String field, String text) {

    public String location() {
        return sheet + "!" + column + row;
    }
}
