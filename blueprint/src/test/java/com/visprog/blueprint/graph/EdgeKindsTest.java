package com.visprog.blueprint.graph;

import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.EdgeKind;
import com.visprog.blueprint.model.LegacyEdgeSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.visprog.blueprint.BlueprintFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class EdgeKindsTest {

    @Test
    void explicitKindWins() {
        LegacyEdgeSnapshot legacy = new LegacyEdgeSnapshot("x", "A", null, "B", null, EdgeKind.CONTROL, null);
        Edge e = new Edge("x", "A", null, "B", null, EdgeKind.DATA, legacy);

        assertEquals(EdgeKind.DATA, EdgeKinds.effectiveKind(e));
    }

    @Test
    void nestedKindIsSecondChoice() {
        assertEquals(EdgeKind.DATA, EdgeKinds.effectiveKind(legacyEdge("x", "A", "B", EdgeKind.DATA)));
    }

    @Test
    void noKindAnywhereIsControl() {
        assertEquals(EdgeKind.CONTROL, EdgeKinds.effectiveKind(untypedEdge("x", "A", "B")));
        assertEquals(EdgeKind.CONTROL, EdgeKinds.effectiveKind(legacyEdge("y", "A", "B", null)));
        assertTrue(EdgeKinds.legacyKind(untypedEdge("x", "A", "B")).isEmpty());
    }

    @Test
    void portsFallBackToNestedSnapshot() {
        Edge e = legacyEdge("x", "A", "B", EdgeKind.DATA);

        assertEquals("value-out", EdgeKinds.effectiveSourcePort(e));
        assertEquals("value-in", EdgeKinds.effectiveTargetPort(e));
        assertNull(EdgeKinds.effectiveSourcePort(untypedEdge("u", "A", "B")));
    }

    @Test
    void controlAdjacencyKeepsDeclarationOrder() {
        var edges = concat(chain("A", "C"), List.of(dataEdge("A", "D")), chain("A", "B"));

        assertEquals(Map.of("A", List.of("C", "B")), EdgeKinds.controlAdjacency(edges));
    }
}
