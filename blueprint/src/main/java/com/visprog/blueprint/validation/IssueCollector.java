package com.visprog.blueprint.validation;

import java.util.ArrayList;
import java.util.List;

/** Accumulates issues in the order the rules report them. */
final class IssueCollector {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<ValidationIssue> issues = new ArrayList<>();

    void error(IssueCode code, String message, List<String> nodes, List<String> edges) {
        add(new ValidationIssue(Severity.ERROR, code, message, nodes, edges));
    }

    void warning(IssueCode code, String message, List<String> nodes, List<String> edges) {
        add(new ValidationIssue(Severity.WARNING, code, message, nodes, edges));
    }

    private void add(ValidationIssue issue) {
        switch (issue.severity()) {
            case ERROR -> errors.add(issue.message());
            case WARNING -> warnings.add(issue.message());
        }
        issues.add(issue);
    }

    ValidationResult toResult() {
        return new ValidationResult(errors.isEmpty(), errors, warnings, issues);
    }
}
