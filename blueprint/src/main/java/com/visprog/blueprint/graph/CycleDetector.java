package com.visprog.blueprint.graph;

import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.Node;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Control-flow cycle search. Both searches keep an explicit stack, so graph depth is not
 * limited by the thread stack.
 */
public final class CycleDetector {
    private CycleDetector() {}

    /**
     * First cycle met by a depth-first search started from each node in declaration order,
     * returned closed ({@code [A, B, C, A]}). Empty if the control flow is acyclic.
     */
    public static Optional<List<String>> findCycle(List<Node> nodes, Collection<Edge> edges) {
        Map<String, List<String>> adj = EdgeKinds.controlAdjacency(edges);
        Set<String> visited = new HashSet<>();
        for (Node n : nodes) {
            List<String> cycle = dfs(n.id(), adj, visited);
            if (cycle != null) return Optional.of(cycle);
        }
        return Optional.empty();
    }

    private static List<String> dfs(String startId, Map<String, List<String>> adj, Set<String> visited) {
        if (!visited.add(startId)) return null;

        List<String> path = new ArrayList<>();
        Map<String, Integer> positionOnPath = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        path.add(startId);
        positionOnPath.put(startId, 0);
        stack.push(new Frame(startId));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            List<String> successors = adj.getOrDefault(top.id, List.of());
            if (top.next < successors.size()) {
                String next = successors.get(top.next++);
                Integer pos = positionOnPath.get(next);
                if (pos != null) {
                    List<String> cycle = new ArrayList<>(path.subList(pos, path.size()));
                    cycle.add(next);
                    return cycle;
                }
                if (visited.add(next)) {
                    positionOnPath.put(next, path.size());
                    path.add(next);
                    stack.push(new Frame(next));
                }
            } else {
                stack.pop();
                path.remove(path.size() - 1);
                positionOnPath.remove(top.id);
            }
        }
        return null;
    }

    /**
     * Nodes reachable from {@code startIds} whose execution order depends on a cycle: nodes on a
     * reachable cycle and everything downstream of one.
     */
    public static Set<String> cycleDependentNodes(Collection<String> startIds, Collection<Edge> edges) {
        Map<String, List<String>> adj = EdgeKinds.controlAdjacency(edges);
        Set<String> reachable = Reachability.reachable(startIds, adj);
        Set<String> onCycle = nodesOnCycles(reachable, adj);
        return onCycle.isEmpty() ? Set.of() : Reachability.reachable(onCycle, adj);
    }

    /**
     * Nodes of every strongly connected component with more than one node, plus nodes with a
     * self-edge (Tarjan, one pass over the subgraph reachable from {@code roots}).
     */
    static Set<String> nodesOnCycles(Collection<String> roots, Map<String, List<String>> adj) {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> low = new HashMap<>();
        Deque<String> componentStack = new ArrayDeque<>();
        Set<String> onComponentStack = new HashSet<>();
        Set<String> onCycle = new LinkedHashSet<>();
        int counter = 0;

        for (String root : roots) {
            if (index.containsKey(root)) continue;
            Deque<Frame> work = new ArrayDeque<>();
            index.put(root, counter);
            low.put(root, counter++);
            componentStack.push(root);
            onComponentStack.add(root);
            work.push(new Frame(root));

            while (!work.isEmpty()) {
                Frame top = work.peek();
                List<String> successors = adj.getOrDefault(top.id, List.of());
                if (top.next < successors.size()) {
                    String next = successors.get(top.next++);
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        low.put(next, counter++);
                        componentStack.push(next);
                        onComponentStack.add(next);
                        work.push(new Frame(next));
                    } else if (onComponentStack.contains(next)) {
                        low.put(top.id, Math.min(low.get(top.id), index.get(next)));
                    }
                    continue;
                }

                work.pop();
                if (!work.isEmpty()) {
                    String parent = work.peek().id;
                    low.put(parent, Math.min(low.get(parent), low.get(top.id)));
                }
                if (low.get(top.id).equals(index.get(top.id))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = componentStack.pop();
                        onComponentStack.remove(member);
                        component.add(member);
                    } while (!member.equals(top.id));
                    if (component.size() > 1 || successors.contains(top.id)) onCycle.addAll(component);
                }
            }
        }
        return onCycle;
    }

    /** A node on the explicit search stack and the index of its next successor to visit. */
    private static final class Frame {
        final String id;
        int next;

        Frame(String id) {
            this.id = id;
        }
    }
}
