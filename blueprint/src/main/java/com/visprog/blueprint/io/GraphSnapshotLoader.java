package com.visprog.blueprint.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visprog.blueprint.io.SnapshotDto.EdgeDto;
import com.visprog.blueprint.io.SnapshotDto.NodeDto;
import com.visprog.blueprint.io.SnapshotDto.PortDto;
import com.visprog.blueprint.io.SnapshotDto.VariableDto;
import com.visprog.blueprint.model.BlueprintSnapshot;
import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.EdgeKind;
import com.visprog.blueprint.model.Graph;
import com.visprog.blueprint.model.LegacyEdgeSnapshot;
import com.visprog.blueprint.model.Node;
import com.visprog.blueprint.model.Port;
import com.visprog.blueprint.model.VariableDeclaration;
import com.visprog.blueprint.registry.NodeTypeRegistry;
import com.visprog.common.codec.Codec;
import com.visprog.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads editor snapshots ({@code {nodes, edges, variables}}) into {@link BlueprintSnapshot}.
 * <p>
 * Malformed input is an error value, never an exception. All problems found in one file are
 * reported together.
 */
public final class GraphSnapshotLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphSnapshotLoader.class);

    private static final Codec<SnapshotDto, String> CODEC =
            Codec.clazzCodec(BlueprintJson.base(new ObjectMapper()), SnapshotDto.class);

    private final NodeTypeRegistry registry;

    public GraphSnapshotLoader(NodeTypeRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ErrorsOr<BlueprintSnapshot> fromJson(String json) {
        ErrorsOr<BlueprintSnapshot> result = CODEC.decode(json).flatMap(this::toSnapshot);
        result.ifError(errors -> log.warn("Rejected blueprint snapshot: {}", errors));
        return result;
    }

    public ErrorsOr<BlueprintSnapshot> fromJson(InputStream in) {
        return ErrorsOr.trying(() -> new String(in.readAllBytes(), StandardCharsets.UTF_8),
                        e -> "Cannot read snapshot stream: " + e.getMessage())
                .flatMap(json -> fromJson(json));
    }

    public ErrorsOr<BlueprintSnapshot> fromJson(Path file) {
        return ErrorsOr.trying(() -> Files.readString(file, StandardCharsets.UTF_8),
                        e -> "Cannot read snapshot " + file + ": " + e)
                .flatMap(json -> fromJson(json).addPrefixIfError(file.getFileName() + ": "));
    }

    private ErrorsOr<BlueprintSnapshot> toSnapshot(SnapshotDto dto) {
        List<ErrorsOr<Node>> nodes = new ArrayList<>();
        List<NodeDto> nodeDtos = orEmpty(dto.nodes());
        for (int i = 0; i < nodeDtos.size(); i++) nodes.add(toNode(i, nodeDtos.get(i)));

        List<ErrorsOr<Edge>> edges = new ArrayList<>();
        List<EdgeDto> edgeDtos = orEmpty(dto.edges());
        for (int i = 0; i < edgeDtos.size(); i++) edges.add(toEdge(i, edgeDtos.get(i)));

        List<ErrorsOr<VariableDeclaration>> variables = new ArrayList<>();
        List<VariableDto> variableDtos = orEmpty(dto.variables());
        for (int i = 0; i < variableDtos.size(); i++) variables.add(toVariable(i, variableDtos.get(i)));

        ErrorsOr<List<Node>> n = ErrorsOr.sequence(nodes);
        ErrorsOr<List<Edge>> e = ErrorsOr.sequence(edges);
        ErrorsOr<List<VariableDeclaration>> v = ErrorsOr.sequence(variables);

        List<String> errors = new ArrayList<>();
        n.ifError(errors::addAll);
        e.ifError(errors::addAll);
        v.ifError(errors::addAll);
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);
        return ErrorsOr.lift(new BlueprintSnapshot(
                new Graph(n.valueOrThrow(), e.valueOrThrow()), v.valueOrThrow()));
    }

    private ErrorsOr<Node> toNode(int index, NodeDto dto) {
        if (dto == null) return ErrorsOr.error("Node #" + index + " is null");
        NodeDto inner = dto.blueprintNode() != null ? dto.blueprintNode() : dto;
        String id = firstNonBlank(dto.id(), inner.id());
        if (id == null) return ErrorsOr.error("Node #" + index + " has no id");

        String label = firstNonBlank(inner.customLabel(), dto.customLabel(), inner.label(), dto.label());
        List<Port> inputs = toPorts(inner.inputs() != null ? inner.inputs() : dto.inputs());
        List<Port> outputs = toPorts(inner.outputs() != null ? inner.outputs() : dto.outputs());
        Map<String, Object> properties = inner.properties() != null ? inner.properties() : dto.properties();
        return ErrorsOr.lift(new Node(id, registry.kindOf(inner.type()), label, inputs, outputs, properties));
    }

    private static List<Port> toPorts(List<PortDto> dtos) {
        List<Port> ports = new ArrayList<>();
        for (PortDto p : orEmpty(dtos)) {
            if (p != null && p.id() != null) ports.add(new Port(p.id(), p.dataType(), p.variableId()));
        }
        return ports;
    }

    private ErrorsOr<Edge> toEdge(int index, EdgeDto dto) {
        if (dto == null) return ErrorsOr.error("Edge #" + index + " is null");
        EdgeDto nested = dto.blueprintEdge();
        String id = firstNonBlank(dto.id(), nested == null ? null : nested.id(), "edge-" + index);
        String prefix = "Edge #" + index + " (" + id + ") ";

        List<String> errors = new ArrayList<>();
        String source = firstNonBlank(dto.source(), nested == null ? null : nested.source());
        String target = firstNonBlank(dto.target(), nested == null ? null : nested.target());
        if (source == null) errors.add(prefix + "has no source node");
        if (target == null) errors.add(prefix + "has no target node");

        EdgeKind kind = parseKind(dto.kind(), prefix, errors);
        LegacyEdgeSnapshot legacy = null;
        if (nested != null) {
            legacy = new LegacyEdgeSnapshot(nested.id(), nested.source(), nested.sourcePort(),
                    nested.target(), nested.targetPort(), parseKind(nested.kind(), prefix + "nested edge ", errors),
                    nested.dataType());
        }
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);
        return ErrorsOr.lift(new Edge(id, source, dto.sourcePort(), target, dto.targetPort(), kind, legacy));
    }

    /** A missing kind stays {@code null} so the effective kind can fall back; an unknown one is an error. */
    private static EdgeKind parseKind(String wire, String prefix, List<String> errors) {
        if (wire == null || wire.isBlank()) return null;
        return EdgeKind.fromWire(wire).orElseGet(() -> {
            errors.add(prefix + "has unknown kind '" + wire + "'");
            return null;
        });
    }

    private static ErrorsOr<VariableDeclaration> toVariable(int index, VariableDto dto) {
        if (dto == null || firstNonBlank(dto.id()) == null) return ErrorsOr.error("Variable #" + index + " has no id");
        return ErrorsOr.lift(new VariableDeclaration(dto.id(), dto.name(), dto.dataType(), dto.defaultValue()));
    }

    private static String firstNonBlank(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c;
        }
        return null;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
