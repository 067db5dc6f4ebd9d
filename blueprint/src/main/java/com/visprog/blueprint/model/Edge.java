package com.visprog.blueprint.model;

import java.util.Objects;

/**
 * A link between two nodes. {@code kind}, {@code sourcePort}, {@code targetPort} and
 * {@code legacy} are optional; use {@code EdgeKinds} to read the effective values.
 */
public record Edge(String id, String source, String sourcePort, String target, String targetPort,
                   EdgeKind kind, LegacyEdgeSnapshot legacy) {

    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static Edge control(String id, String source, String target) {
        return new Edge(id, source, null, target, null, EdgeKind.CONTROL, null);
    }

    public static Edge data(String id, String source, String sourcePort, String target, String targetPort) {
        return new Edge(id, source, sourcePort, target, targetPort, EdgeKind.DATA, null);
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }
}
