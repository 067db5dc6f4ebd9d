package com.visprog.blueprint.model;

/**
 * The port-level edge that older editor files nest inside a coarse edge. Only the fields the
 * analysis reads are kept.
 */
public record LegacyEdgeSnapshot(String id, String sourceNode, String sourcePort,
                                 String targetNode, String targetPort, EdgeKind kind, String dataType) {
}
