package com.visprog.blueprint.resolve;

import com.visprog.blueprint.model.Node;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Value an assignment node writes when nothing is wired into it. */
public final class ValueDefaults {
    private ValueDefaults() {}

    /**
     * Explicit override first, then the variable's declared default, then the node's own input value,
     * then the zero value of the node's data kind ({@code fallbackDataKind} when the node names none).
     */
    public static Object effectiveManualValue(Node assignment, Object variableDefault, String fallbackDataKind) {
        Map<String, Object> props = assignment.properties();
        Object inputValue = props.get(Node.INPUT_VALUE);
        if (Boolean.TRUE.equals(props.get(Node.INPUT_VALUE_IS_OVERRIDE)) && inputValue != null) return inputValue;
        if (variableDefault != null) return variableDefault;
        if (inputValue != null) return inputValue;
        Object nodeKind = props.get(Node.DATA_TYPE);
        return defaultForDataKind(nodeKind instanceof String s ? s : fallbackDataKind);
    }

    public static Object defaultForDataKind(String dataKind) {
        if (dataKind == null) return null;
        return switch (dataKind.toLowerCase(Locale.ROOT)) {
            case "bool", "boolean" -> false;
            case "int32", "int64", "float", "double" -> 0;
            case "string" -> "";
            case "vector" -> List.of(0, 0, 0);
            default -> null;
        };
    }
}
