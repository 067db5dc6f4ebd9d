package com.visprog.blueprint.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A graph node as the editor hands it over. {@code properties} holds the editor's free-form
 * settings ({@value #VARIABLE_ID}, {@value #INPUT_VALUE}, {@value #INPUT_VALUE_IS_OVERRIDE},
 * {@value #DATA_TYPE}); values may be {@code null}.
 */
public record Node(String id, NodeKind kind, String label, List<Port> inputs, List<Port> outputs,
                   Map<String, Object> properties) {

    public static final String VARIABLE_ID = "variableId";
    public static final String INPUT_VALUE = "inputValue";
    public static final String INPUT_VALUE_IS_OVERRIDE = "inputValueIsOverride";
    public static final String DATA_TYPE = "dataType";

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        label = (label == null || label.isBlank()) ? id : label;
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Node of(String id, NodeKind kind, String label) {
        return new Node(id, kind, label, List.of(), List.of(), Map.of());
    }

    public List<Port> ports() {
        List<Port> all = new ArrayList<>(inputs.size() + outputs.size());
        all.addAll(inputs);
        all.addAll(outputs);
        return all;
    }

    /** Variable bound to this node: the {@value #VARIABLE_ID} property, else the first port reference. */
    public Optional<String> variableId() {
        Object v = properties.get(VARIABLE_ID);
        if (v instanceof String s && !s.isEmpty()) return Optional.of(s);
        for (Port p : ports()) {
            if (p.variableId() != null && !p.variableId().isEmpty()) return Optional.of(p.variableId());
        }
        return Optional.empty();
    }
}
