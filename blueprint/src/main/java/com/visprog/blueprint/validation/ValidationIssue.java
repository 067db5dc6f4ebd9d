package com.visprog.blueprint.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/** One finding with the node and edge ids the editor should highlight. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ValidationIssue(Severity severity, IssueCode code, String message, List<String> nodes, List<String> edges) {
    public ValidationIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
