package com.visprog.blueprint;

import com.visprog.blueprint.config.AnalysisConfig;
import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.EdgeKind;
import com.visprog.blueprint.model.Graph;
import com.visprog.blueprint.model.LegacyEdgeSnapshot;
import com.visprog.blueprint.model.Node;
import com.visprog.blueprint.model.NodeKind;
import com.visprog.blueprint.model.Port;
import com.visprog.blueprint.model.VariableDeclaration;
import com.visprog.blueprint.registry.BlueprintNodeTC;
import com.visprog.blueprint.registry.DefaultBlueprintNodeTC;
import com.visprog.blueprint.registry.NodeTypeRegistry;
import com.visprog.blueprint.registry.NodeTypeRegistryLoader;

import java.io.InputStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reusable fixture for graph tests.
 * - Nodes carry execution pins the way the editor creates them
 * - Variable nodes: {@link #get}/{@link #set} are bound to a variable, {@link #variable} has no pins
 * - Edge ids are "e:source->target"
 */
public final class BlueprintFixture {
    private BlueprintFixture() {}

    public static final AnalysisConfig CONFIG = AnalysisConfig.defaults();
    public static final BlueprintNodeTC ntc = new DefaultBlueprintNodeTC(CONFIG);

    // ---------- Nodes ----------
    public static Node start(String id) {
        return new Node(id, NodeKind.ENTRY, "Start", List.of(), List.of(Port.control("exec-out")), Map.of());
    }

    public static Node end(String id) {
        return new Node(id, NodeKind.EXIT, "End", List.of(Port.control("exec-in")), List.of(), Map.of());
    }

    public static Node function(String id, String label) {
        return new Node(id, NodeKind.OPERATION, label,
                List.of(Port.control("exec-in")), List.of(Port.control("exec-out")), Map.of());
    }

    /** Pure data variable node: no execution pins. */
    public static Node variable(String id, String variableId) {
        return new Node(id, NodeKind.VARIABLE, id, List.of(), List.of(Port.data("value-out", "any")),
                Map.of(Node.VARIABLE_ID, variableId));
    }

    public static Node get(String id, String variableId) {
        return new Node(id, NodeKind.VARIABLE_GET, "Get " + variableId, List.of(),
                List.of(Port.data("value-out", "any")), Map.of(Node.VARIABLE_ID, variableId));
    }

    public static Node set(String id, String variableId) {
        return set(id, variableId, Map.of());
    }

    /** Assignment node with extra properties (inputValue, inputValueIsOverride, dataType). */
    public static Node set(String id, String variableId, Map<String, Object> extra) {
        Map<String, Object> props = new LinkedHashMap<>(extra);
        props.put(Node.VARIABLE_ID, variableId);
        return new Node(id, NodeKind.VARIABLE_ASSIGN, "Set " + variableId,
                List.of(Port.control("exec-in"), Port.data("value-in", "any")),
                List.of(Port.control("exec-out"), Port.data("value-out", "any")), props);
    }

    public static Node setOverride(String id, String variableId, Object value) {
        return set(id, variableId, Map.of(Node.INPUT_VALUE, value, Node.INPUT_VALUE_IS_OVERRIDE, true));
    }

    // ---------- Edges ----------
    public static Edge exec(String source, String target) {
        return Edge.control("e:" + source + "->" + target, source, target);
    }

    /** Control edges along a path: chain("S", "A", "E") gives S->A and A->E. */
    public static List<Edge> chain(String... ids) {
        Edge[] edges = new Edge[ids.length - 1];
        for (int i = 0; i < edges.length; i++) edges[i] = exec(ids[i], ids[i + 1]);
        return Arrays.asList(edges);
    }

    public static Edge dataEdge(String source, String target) {
        return Edge.data("d:" + source + "->" + target, source, "value-out", target, "value-in");
    }

    public static Edge dataEdge(String id, String source, String sourcePort, String target, String targetPort) {
        return Edge.data(id, source, sourcePort, target, targetPort);
    }

    /** Edge whose kind is only known from the nested legacy snapshot. */
    public static Edge legacyEdge(String id, String source, String target, EdgeKind nestedKind) {
        LegacyEdgeSnapshot legacy = new LegacyEdgeSnapshot(id, source, "value-out", target, "value-in", nestedKind, null);
        return new Edge(id, source, null, target, null, null, legacy);
    }

    /** Edge with no kind anywhere. */
    public static Edge untypedEdge(String id, String source, String target) {
        return new Edge(id, source, null, target, null, null, null);
    }

    // ---------- Graphs ----------
    public static Graph graph(List<Node> nodes, List<Edge> edges) {
        return new Graph(nodes, edges);
    }

    @SafeVarargs
    public static <T> List<T> concat(List<T>... lists) {
        return Arrays.stream(lists).flatMap(List::stream).toList();
    }

    public static VariableDeclaration declare(String id, String dataKind, Object defaultValue) {
        return new VariableDeclaration(id, id, dataKind, defaultValue);
    }

    // ---------- Resources ----------
    public static NodeTypeRegistry registry() {
        return NodeTypeRegistryLoader.fromClasspath(CONFIG.nodeTypesResource());
    }

    public static InputStream resourceStream(String path) {
        InputStream in = BlueprintFixture.class.getClassLoader().getResourceAsStream(path);
        if (in == null) throw new IllegalArgumentException("Missing test resource: " + path);
        return in;
    }
}
