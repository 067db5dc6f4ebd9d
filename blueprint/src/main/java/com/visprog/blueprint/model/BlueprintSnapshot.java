package com.visprog.blueprint.model;

import java.util.List;
import java.util.Objects;

/** What the editor sends on every change: the graph plus its variable declarations. */
public record BlueprintSnapshot(Graph graph, List<VariableDeclaration> variables) {
    public BlueprintSnapshot {
        Objects.requireNonNull(graph, "graph");
        variables = variables == null ? List.of() : List.copyOf(variables);
    }
}
