package com.visprog.blueprint.io;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.List;
import java.util.Map;

/**
 * Wire shape of an editor snapshot. Field names follow the editor; the aliases cover the
 * older files that used {@code sourceNode}/{@code targetNode} and {@code dataKind}.
 */
record SnapshotDto(List<NodeDto> nodes, List<EdgeDto> edges, List<VariableDto> variables) {

    /** {@code blueprintNode} is set by older files whose outer {@code type} is only a coarse category. */
    record NodeDto(String id, String type, String label, String customLabel,
                   List<PortDto> inputs, List<PortDto> outputs, Map<String, Object> properties,
                   NodeDto blueprintNode) {
    }

    record PortDto(String id, @JsonAlias("dataKind") String dataType, String variableId) {
    }

    record EdgeDto(String id,
                   @JsonAlias("sourceNode") String source, String sourcePort,
                   @JsonAlias("targetNode") String target, String targetPort,
                   String kind, String dataType,
                   EdgeDto blueprintEdge) {
    }

    record VariableDto(String id, String name, @JsonAlias("dataKind") String dataType, Object defaultValue) {
    }
}
