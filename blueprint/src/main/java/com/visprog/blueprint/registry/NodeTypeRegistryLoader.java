package com.visprog.blueprint.registry;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.visprog.blueprint.io.BlueprintJson;
import com.visprog.blueprint.model.NodeKind;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/** Reads the node type table ({@code {"kinds": {"ENTRY": ["Start"], ...}}}). */
public interface NodeTypeRegistryLoader {

    ObjectMapper JSON = BlueprintJson.base(new ObjectMapper());
    ObjectReader TABLE_READER = JSON.readerFor(new TypeReference<Map<String, Map<NodeKind, List<String>>>>() {});

    static NodeTypeRegistry fromJson(InputStream in) throws IOException {
        Map<String, Map<NodeKind, List<String>>> root = TABLE_READER.readValue(in);
        Map<NodeKind, List<String>> kinds = root == null ? null : root.get("kinds");
        if (kinds == null) {
            throw new IOException("Node type table must have a 'kinds' object");
        }
        return NodeTypeRegistry.fromKindTable(kinds);
    }

    /** Loads a bundled table; a missing or broken resource is a start-up failure. */
    static NodeTypeRegistry fromClasspath(String resource) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = NodeTypeRegistryLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("Node type table not found on classpath: " + resource);
            return fromJson(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read node type table " + resource + ": " + e.getMessage(), e);
        }
    }
}
