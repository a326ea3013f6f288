package com.checklist.emit;

/**
 * Builders for the XPath subset used by XLSForm calculations and relevance.
 */
public final class XPath {

    private XPath() {
    }

    public static String ref(String field) {
        return "${" + field + "}";
    }

    public static String text(String value) {
        return "'" + value + "'";
    }

    public static String selected(String field, String choice) {
        return "selected(" + ref(field) + ", " + text(choice) + ")";
    }

    public static String countSelected(String field) {
        return "count-selected(" + ref(field) + ")";
    }

    public static String number(String field) {
        return "number(" + ref(field) + ")";
    }

    public static String string(String field) {
        return "string(" + ref(field) + ")";
    }

    public static String not(String expression) {
        return "not(" + expression + ")";
    }

    public static String ifThenElse(String condition, String then, String otherwise) {
        return "if(" + condition + ", " + then + ", " + otherwise + ")";
    }

    public static String binary(String left, String operator, String right) {
        return left + " " + operator + " " + right;
    }

    public static String group(String expression) {
        return "(" + expression + ")";
    }
}
