package com.graphflow.graph;

/**
 * One finding of graph validation.
 *
 * @param severity ERROR aborts the build; WARNING is kept on the model
 * @param code     stable machine-readable code, e.g. {@code UNKNOWN_EDGE_TARGET}
 * @param subject  node id or edge ("from->to") the issue is about; may be null
 */
public record ValidationIssue(Severity severity, String code, String subject, String message) {

    public enum Severity { ERROR, WARNING }

    public static ValidationIssue error(String code, String subject, String message) {
        return new ValidationIssue(Severity.ERROR, code, subject, message);
    }

    public static ValidationIssue warning(String code, String subject, String message) {
        return new ValidationIssue(Severity.WARNING, code, subject, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + (subject != null ? " [" + subject + "]" : "") + ": " + message;
    }
}
