package com.visprog.blueprint.registry;

import com.visprog.blueprint.model.Node;
import com.visprog.blueprint.model.NodeCategory;
import com.visprog.blueprint.model.NodeKind;
import com.visprog.blueprint.model.Port;

/** Node semantics the validator and resolver need, supplied by the caller. */
public interface BlueprintNodeTC {

    boolean isControlPort(Port port);

    /** True for the port that carries the value written by an assignment node. */
    boolean isValueInputPort(String portId);

    default NodeCategory category(Node node) {
        return node.kind().category();
    }

    default boolean hasControlPorts(Node node) {
        for (Port p : node.ports()) {
            if (isControlPort(p)) return true;
        }
        return false;
    }

    /** Variable node used only through data edges; it never needs to be reached by control flow. */
    default boolean isPureData(Node node) {
        return category(node) == NodeCategory.VARIABLE && !hasControlPorts(node);
    }

    /** A read of one variable feeding a write of another is the normal way to copy values. */
    default boolean isReadIntoWrite(Node source, Node target) {
        return source.kind() == NodeKind.VARIABLE_GET && target.kind() == NodeKind.VARIABLE_ASSIGN;
    }

    /** Label for messages (defaults to the node label). */
    default String label(Node node) {
        return node.label();
    }
}
