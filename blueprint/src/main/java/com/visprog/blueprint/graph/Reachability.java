package com.visprog.blueprint.graph;

import com.visprog.blueprint.model.Edge;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Breadth-first reachability over control edges. */
public final class Reachability {
    private Reachability() {}

    public static Set<String> reachable(String entryId, Collection<Edge> edges) {
        return reachable(List.of(entryId), edges);
    }

    /** Every node reachable from any of {@code startIds}, the start ids included. */
    public static Set<String> reachable(Collection<String> startIds, Collection<Edge> edges) {
        return reachable(startIds, EdgeKinds.controlAdjacency(edges));
    }

    static Set<String> reachable(Collection<String> startIds, Map<String, List<String>> adj) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(startIds);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) continue;
            for (String next : adj.getOrDefault(current, List.of())) {
                if (!visited.contains(next)) queue.add(next);
            }
        }
        return visited;
    }
}
