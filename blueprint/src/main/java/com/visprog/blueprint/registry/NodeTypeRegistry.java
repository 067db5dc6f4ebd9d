package com.visprog.blueprint.registry;

import com.visprog.blueprint.model.NodeKind;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps editor node type names ({@code "Start"}, {@code "SetVariable"}, {@code "ForLoop"}, ...) to
 * {@link NodeKind}. Names that are not listed are {@link NodeKind#CUSTOM}.
 */
public record NodeTypeRegistry(Map<String, NodeKind> kindsByTypeName) {

    public NodeTypeRegistry {
        kindsByTypeName = Map.copyOf(kindsByTypeName);
    }

    /** Inverts the on-disk shape (kind to list of names); a name listed twice is a configuration error. */
    public static NodeTypeRegistry fromKindTable(Map<NodeKind, List<String>> table) {
        Map<String, NodeKind> byName = new LinkedHashMap<>();
        Map<NodeKind, List<String>> ordered = new EnumMap<>(NodeKind.class);
        ordered.putAll(table);
        ordered.forEach((kind, names) -> {
            for (String name : names) {
                NodeKind prev = byName.putIfAbsent(name, kind);
                if (prev != null && prev != kind) {
                    throw new IllegalStateException("Node type '" + name + "' is listed as both " + prev + " and " + kind);
                }
            }
        });
        return new NodeTypeRegistry(byName);
    }

    public NodeKind kindOf(String typeName) {
        if (typeName == null) return NodeKind.CUSTOM;
        return kindsByTypeName.getOrDefault(typeName, NodeKind.CUSTOM);
    }
}
