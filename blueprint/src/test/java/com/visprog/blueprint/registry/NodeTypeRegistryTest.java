package com.visprog.blueprint.registry;

import com.visprog.blueprint.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.visprog.blueprint.BlueprintFixture.registry;
import static org.junit.jupiter.api.Assertions.*;

public class NodeTypeRegistryTest {

    @Test
    void bundledTable_mapsEditorNames() {
        NodeTypeRegistry r = registry();

        assertEquals(NodeKind.ENTRY, r.kindOf("Start"));
        assertEquals(NodeKind.EXIT, r.kindOf("End"));
        assertEquals(NodeKind.EXIT, r.kindOf("Return"));
        assertEquals(NodeKind.VARIABLE, r.kindOf("Variable"));
        assertEquals(NodeKind.VARIABLE_GET, r.kindOf("GetVariable"));
        assertEquals(NodeKind.VARIABLE_ASSIGN, r.kindOf("SetVariable"));
        assertEquals(NodeKind.OPERATION, r.kindOf("ForLoop"));
        assertEquals(NodeKind.OPERATION, r.kindOf("Print"));
        assertEquals(NodeKind.CUSTOM, r.kindOf("Custom"));
    }

    @Test
    void unknownOrMissingName_isCustom() {
        assertEquals(NodeKind.CUSTOM, registry().kindOf("NoSuchNode"));
        assertEquals(NodeKind.CUSTOM, registry().kindOf(null));
    }

    @Test
    void nameListedUnderTwoKinds_isRejected() {
        var e = assertThrows(IllegalStateException.class, () -> NodeTypeRegistry.fromKindTable(Map.of(
                NodeKind.ENTRY, List.of("Start"),
                NodeKind.OPERATION, List.of("Print", "Start"))));

        assertTrue(e.getMessage().contains("Start"), e.getMessage());
    }

    @Test
    void tableWithoutKinds_isRejected() {
        var in = new ByteArrayInputStream("{\"other\": {}}".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> NodeTypeRegistryLoader.fromJson(in));
    }

    @Test
    void missingResource_failsAtStartup() {
        var e = assertThrows(IllegalStateException.class, () -> NodeTypeRegistryLoader.fromClasspath("blueprint/missing.json"));

        assertTrue(e.getMessage().contains("blueprint/missing.json"), e.getMessage());
    }
}
