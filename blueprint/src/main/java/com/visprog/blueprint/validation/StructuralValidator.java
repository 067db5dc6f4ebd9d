package com.visprog.blueprint.validation;

import com.visprog.blueprint.graph.CycleDetector;
import com.visprog.blueprint.graph.EdgeKinds;
import com.visprog.blueprint.graph.Reachability;
import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.EdgeKind;
import com.visprog.blueprint.model.Graph;
import com.visprog.blueprint.model.Node;
import com.visprog.blueprint.model.NodeCategory;
import com.visprog.blueprint.registry.BlueprintNodeTC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a graph is a structurally legal program.
 * <p>
 * All rules run and all findings are collected; only an empty graph stops early. A result with
 * {@code ok} set guarantees exactly one Entry, at least one Exit, no illegal or dangling edges,
 * every node except pure data nodes reachable from Entry, and no control-flow cycle.
 * Never throws for any graph content and never modifies the graph.
 */
public final class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private final BlueprintNodeTC ntc;

    public StructuralValidator(BlueprintNodeTC ntc) {
        this.ntc = Objects.requireNonNull(ntc, "ntc");
    }

    public ValidationResult validate(Graph graph) {
        Objects.requireNonNull(graph, "graph");
        IssueCollector issues = new IssueCollector();

        if (graph.nodes().isEmpty()) {
            issues.error(IssueCode.EMPTY_GRAPH, "Graph must contain at least one node.", List.of(), List.of());
            return issues.toResult();
        }

        List<Node> entries = nodesOf(graph, NodeCategory.ENTRY);
        List<Node> exits = nodesOf(graph, NodeCategory.EXIT);
        checkEntryAndExitCount(entries, exits, issues);

        Map<String, Node> byId = graph.nodesById();
        List<Edge> classified = new ArrayList<>();
        List<Edge> control = new ArrayList<>();
        List<Edge> data = new ArrayList<>();
        List<Edge> edges = graph.edges();
        for (int i = 0; i < edges.size(); i++) {
            Edge edge = edges.get(i);
            Node source = byId.get(edge.source());
            Node target = byId.get(edge.target());
            if (source == null || target == null) {
                issues.error(IssueCode.DANGLING_EDGE, "Edge #" + (i + 1) + " (" + edge.id() + ") references missing nodes.",
                        List.of(), List.of(edge.id()));
                continue;
            }
            if (edge.isSelfLoop()) {
                issues.error(IssueCode.SELF_LOOP, "Edge " + edge.id() + " creates a self-loop.",
                        List.of(source.id()), List.of(edge.id()));
                continue;
            }
            classified.add(edge);
            switch (EdgeKinds.effectiveKind(edge)) {
                case CONTROL -> {
                    control.add(edge);
                    checkControlEdge(edge, source, target, issues);
                }
                case DATA -> {
                    data.add(edge);
                    checkDataEdge(edge, source, target, issues);
                }
            }
        }

        if (graph.nodes().size() > 1 && control.isEmpty()) {
            issues.error(IssueCode.NO_CONTROL_FLOW, "Graph does not contain control-flow connections.", List.of(), List.of());
        }

        checkDuplicates(classified, issues);

        Node entry = entries.size() == 1 ? entries.get(0) : null;
        if (entry != null) checkEntryEdges(entry, control, issues);
        for (Node exit : exits) checkExitEdges(exit, control, issues);

        if (entry != null && !control.isEmpty()) checkReachability(graph, entry, control, issues);

        CycleDetector.findCycle(graph.nodes(), control).ifPresent(cycle ->
                issues.error(IssueCode.CONTROL_CYCLE, "Control-flow cycle detected: " + String.join(" -> ", cycle),
                        List.copyOf(new LinkedHashSet<>(cycle)), List.of()));

        checkVariableToVariable(data, byId, issues);

        ValidationResult result = issues.toResult();
        log.debug("Graph validation completed. ok={} errors={} warnings={}",
                result.ok(), result.errors().size(), result.warnings().size());
        return result;
    }

    private List<Node> nodesOf(Graph graph, NodeCategory category) {
        return graph.nodes().stream().filter(n -> ntc.category(n) == category).toList();
    }

    private void checkEntryAndExitCount(List<Node> entries, List<Node> exits, IssueCollector issues) {
        if (entries.isEmpty()) {
            issues.error(IssueCode.MISSING_ENTRY, "Graph must contain an Entry node.", List.of(), List.of());
        } else if (entries.size() > 1) {
            issues.error(IssueCode.MULTIPLE_ENTRY, "Only one Entry node is allowed (found " + entries.size() + ").",
                    ids(entries), List.of());
        }
        if (exits.isEmpty()) {
            issues.error(IssueCode.MISSING_EXIT, "Graph must contain at least one Exit node.", List.of(), List.of());
        }
    }

    private void checkControlEdge(Edge edge, Node source, Node target, IssueCollector issues) {
        if (ntc.category(source) == NodeCategory.EXIT) {
            issues.error(IssueCode.CONTROL_FROM_EXIT,
                    "Control edge " + arrow(edge) + " cannot start from Exit node \"" + ntc.label(source) + "\".",
                    List.of(source.id()), List.of(edge.id()));
        }
        if (ntc.category(target) == NodeCategory.ENTRY) {
            issues.error(IssueCode.CONTROL_INTO_ENTRY,
                    "Control edge " + arrow(edge) + " cannot target Entry node \"" + ntc.label(target) + "\".",
                    List.of(target.id()), List.of(edge.id()));
        }
    }

    private void checkDataEdge(Edge edge, Node source, Node target, IssueCollector issues) {
        if (ntc.category(source) == NodeCategory.ENTRY || ntc.category(target) == NodeCategory.ENTRY) {
            issues.error(IssueCode.DATA_TOUCHES_ENTRY, "Data edge " + arrow(edge) + " cannot involve Entry nodes.",
                    List.of(source.id(), target.id()), List.of(edge.id()));
        }
        if (ntc.category(source) == NodeCategory.EXIT) {
            issues.error(IssueCode.DATA_FROM_EXIT, "Data edge " + arrow(edge) + " cannot originate from Exit nodes.",
                    List.of(source.id()), List.of(edge.id()));
        }
    }

    /** Same endpoints, effective kind and ports. Different ports between the same nodes are fine. */
    private void checkDuplicates(List<Edge> edges, IssueCollector issues) {
        Map<EdgeSignature, Edge> seen = new HashMap<>();
        for (Edge edge : edges) {
            EdgeSignature sig = EdgeSignature.of(edge);
            Edge first = seen.putIfAbsent(sig, edge);
            if (first != null) {
                issues.warning(IssueCode.DUPLICATE_EDGE,
                        "Duplicate edge " + arrow(edge) + " (" + sig.kind().wireName()
                                + sig.describePorts().map(p -> ", " + p).orElse("") + ").",
                        List.of(), List.of(first.id(), edge.id()));
            }
        }
    }

    private void checkEntryEdges(Node entry, List<Edge> control, IssueCollector issues) {
        if (control.stream().anyMatch(e -> e.target().equals(entry.id()))) {
            issues.error(IssueCode.ENTRY_HAS_INCOMING, "Entry node cannot have incoming control edges.",
                    List.of(entry.id()), List.of());
        }
        if (control.stream().noneMatch(e -> e.source().equals(entry.id()))) {
            issues.warning(IssueCode.ENTRY_HAS_NO_OUTGOING, "Entry node has no outgoing control edges.",
                    List.of(entry.id()), List.of());
        }
    }

    private void checkExitEdges(Node exit, List<Edge> control, IssueCollector issues) {
        if (control.stream().anyMatch(e -> e.source().equals(exit.id()))) {
            issues.error(IssueCode.EXIT_HAS_OUTGOING,
                    "Exit node \"" + ntc.label(exit) + "\" cannot have outgoing control edges.",
                    List.of(exit.id()), List.of());
        }
        if (control.stream().noneMatch(e -> e.target().equals(exit.id()))) {
            issues.warning(IssueCode.EXIT_HAS_NO_INCOMING,
                    "Exit node \"" + ntc.label(exit) + "\" has no incoming control edges.",
                    List.of(exit.id()), List.of());
        }
    }

    private void checkReachability(Graph graph, Node entry, List<Edge> control, IssueCollector issues) {
        Set<String> reachable = Reachability.reachable(entry.id(), control);
        List<Node> unreachable = graph.nodes().stream()
                .filter(n -> ntc.category(n) != NodeCategory.ENTRY)
                .filter(n -> !reachable.contains(n.id()))
                .filter(n -> !ntc.isPureData(n))
                .toList();
        if (!unreachable.isEmpty()) {
            issues.error(IssueCode.UNREACHABLE_NODES,
                    "Unreachable nodes: " + String.join(", ", unreachable.stream().map(ntc::label).toList()) + ".",
                    ids(unreachable), List.of());
        }
    }

    private void checkVariableToVariable(List<Edge> data, Map<String, Node> byId, IssueCollector issues) {
        for (Edge edge : data) {
            Node source = byId.get(edge.source());
            Node target = byId.get(edge.target());
            if (ntc.category(source) == NodeCategory.VARIABLE
                    && ntc.category(target) == NodeCategory.VARIABLE
                    && !ntc.isReadIntoWrite(source, target)) {
                issues.warning(IssueCode.VARIABLE_TO_VARIABLE_DATA,
                        "Data edge " + arrow(edge) + " connects two Variable nodes.",
                        List.of(source.id(), target.id()), List.of(edge.id()));
            }
        }
    }

    private static String arrow(Edge edge) {
        return edge.source() + " -> " + edge.target();
    }

    private static List<String> ids(List<Node> nodes) {
        return nodes.stream().map(Node::id).toList();
    }

    /** Identity of an edge for duplicate detection. Ports may be {@code null}. */
    record EdgeSignature(String source, String target, EdgeKind kind, String sourcePort, String targetPort) {
        static EdgeSignature of(Edge edge) {
            return new EdgeSignature(edge.source(), edge.target(), EdgeKinds.effectiveKind(edge),
                    EdgeKinds.effectiveSourcePort(edge), EdgeKinds.effectiveTargetPort(edge));
        }

        Optional<String> describePorts() {
            if (sourcePort == null && targetPort == null) return Optional.empty();
            return Optional.of(sourcePort + " -> " + targetPort);
        }
    }
}
