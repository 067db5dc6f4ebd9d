package com.visprog.blueprint.graph;

import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.EdgeKind;
import com.visprog.blueprint.model.LegacyEdgeSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Effective edge attributes. An edge read from an older file may carry its real kind and ports
 * only in the nested {@link LegacyEdgeSnapshot}; every lookup goes explicit value first, nested
 * snapshot second. Remove the second step once no such files remain.
 */
public final class EdgeKinds {
    private EdgeKinds() {}

    public static EdgeKind effectiveKind(Edge edge) {
        if (edge.kind() != null) return edge.kind();
        return legacyKind(edge).orElse(EdgeKind.CONTROL);
    }

    static Optional<EdgeKind> legacyKind(Edge edge) {
        LegacyEdgeSnapshot legacy = edge.legacy();
        return legacy == null ? Optional.empty() : Optional.ofNullable(legacy.kind());
    }

    /** Source port id, or {@code null} when neither the edge nor its nested snapshot names one. */
    public static String effectiveSourcePort(Edge edge) {
        if (edge.sourcePort() != null) return edge.sourcePort();
        return edge.legacy() == null ? null : edge.legacy().sourcePort();
    }

    public static String effectiveTargetPort(Edge edge) {
        if (edge.targetPort() != null) return edge.targetPort();
        return edge.legacy() == null ? null : edge.legacy().targetPort();
    }

    public static boolean isControl(Edge edge) {
        return effectiveKind(edge) == EdgeKind.CONTROL;
    }

    /** source id -> target ids over control edges, in edge declaration order. */
    public static Map<String, List<String>> controlAdjacency(Collection<Edge> edges) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (Edge e : edges) {
            if (isControl(e)) adj.computeIfAbsent(e.source(), k -> new ArrayList<>()).add(e.target());
        }
        return adj;
    }
}
