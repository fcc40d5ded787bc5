package com.graphflow.graph;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Graph structure is invalid. Thrown only at build time.
 */
public final class GraphValidationException extends IllegalArgumentException {

    private final List<ValidationIssue> issues;

    public GraphValidationException(String workflowId, List<ValidationIssue> issues) {
        super("Invalid graph '" + workflowId + "': " + issues.stream()
                .map(ValidationIssue::toString)
                .collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public boolean hasIssue(String code) {
        return issues.stream().anyMatch(i -> i.code().equals(code));
    }
}
