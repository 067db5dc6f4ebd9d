package com.visprog.blueprint.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Immutable snapshot: nodes in declaration order plus edges in declaration order. */
public record Graph(List<Node> nodes, List<Edge> edges) {

    public Graph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public static Graph empty() {
        return new Graph(List.of(), List.of());
    }

    /** Id index in declaration order; the first node wins if an id repeats. */
    public Map<String, Node> nodesById() {
        Map<String, Node> byId = new LinkedHashMap<>();
        for (Node n : nodes) byId.putIfAbsent(n.id(), n);
        return byId;
    }
}
