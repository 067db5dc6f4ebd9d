package com.visprog.blueprint.validation;

import java.util.List;

/**
 * Outcome of {@link StructuralValidator#validate}. {@code errors} and {@code warnings} repeat the
 * messages of {@code issues} split by severity; {@code ok} is true iff there are no errors.
 */
public record ValidationResult(boolean ok, List<String> errors, List<String> warnings, List<ValidationIssue> issues) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        issues = List.copyOf(issues);
    }

    public List<ValidationIssue> issuesWith(IssueCode code) {
        return issues.stream().filter(i -> i.code() == code).toList();
    }

    public boolean has(IssueCode code) {
        return issues.stream().anyMatch(i -> i.code() == code);
    }
}
