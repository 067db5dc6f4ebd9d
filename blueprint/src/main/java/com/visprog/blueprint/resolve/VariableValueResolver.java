package com.visprog.blueprint.resolve;

import com.visprog.blueprint.graph.CycleDetector;
import com.visprog.blueprint.graph.EdgeKinds;
import com.visprog.blueprint.graph.Reachability;
import com.visprog.blueprint.model.Edge;
import com.visprog.blueprint.model.EdgeKind;
import com.visprog.blueprint.model.Graph;
import com.visprog.blueprint.model.Node;
import com.visprog.blueprint.model.NodeCategory;
import com.visprog.blueprint.model.NodeKind;
import com.visprog.blueprint.model.VariableDeclaration;
import com.visprog.blueprint.registry.BlueprintNodeTC;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Works out what each declared variable holds by tracing the assignments reachable from Entry.
 * <p>
 * Every declared variable gets a record, in declaration order. The input graph is never modified
 * and nothing is kept between calls.
 */
public final class VariableValueResolver {

    private static final Logger log = LoggerFactory.getLogger(VariableValueResolver.class);

    private final BlueprintNodeTC ntc;

    public VariableValueResolver(BlueprintNodeTC ntc) {
        this.ntc = Objects.requireNonNull(ntc, "ntc");
    }

    public Map<String, VariableResolution> resolve(Graph graph, List<VariableDeclaration> variables) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(variables, "variables");

        List<String> startIds = graph.nodes().stream()
                .filter(n -> ntc.category(n) == NodeCategory.ENTRY)
                .map(Node::id)
                .toList();

        Map<String, VariableResolution> out = new LinkedHashMap<>();
        if (startIds.isEmpty()) {
            for (VariableDeclaration v : variables) out.put(v.id(), VariableResolution.unknown(v.defaultValue()));
        } else {
            Pass pass = new Pass(graph, variables, startIds);
            for (VariableDeclaration v : variables) out.put(v.id(), pass.resolveVariable(v.id()));
        }

        if (log.isDebugEnabled()) log.debug("Variable resolution completed. variables={} {}", out.size(), countByStatus(out));
        return Collections.unmodifiableMap(out);
    }

    private static Map<ResolutionStatus, Integer> countByStatus(Map<String, VariableResolution> resolutions) {
        Map<ResolutionStatus, Integer> counts = new EnumMap<>(ResolutionStatus.class);
        for (VariableResolution r : resolutions.values()) counts.merge(r.status(), 1, Integer::sum);
        return counts;
    }

    /** State for one {@link #resolve} call. */
    private final class Pass {
        private final Map<String, Node> byId;
        private final Map<String, VariableDeclaration> declarations = new HashMap<>();
        private final Map<String, List<Node>> reachableAssignments = new HashMap<>();
        private final Map<String, List<Edge>> valueInputs = new HashMap<>();
        private final Set<String> cycleDependent;

        private final Map<String, VariableResolution> memo = new HashMap<>();
        private final Set<String> visiting = new HashSet<>();

        Pass(Graph graph, List<VariableDeclaration> variables, List<String> startIds) {
            this.byId = graph.nodesById();
            for (VariableDeclaration v : variables) declarations.putIfAbsent(v.id(), v);

            Set<String> reachable = Reachability.reachable(startIds, graph.edges());
            this.cycleDependent = CycleDetector.cycleDependentNodes(startIds, graph.edges());

            for (Node n : graph.nodes()) {
                if (n.kind() != NodeKind.VARIABLE_ASSIGN || !reachable.contains(n.id())) continue;
                n.variableId().ifPresent(id -> reachableAssignments.computeIfAbsent(id, k -> new ArrayList<>()).add(n));
            }
            for (Edge e : graph.edges()) {
                if (EdgeKinds.effectiveKind(e) != EdgeKind.DATA) continue;
                String port = EdgeKinds.effectiveTargetPort(e);
                if (port == null || ntc.isValueInputPort(port)) {
                    valueInputs.computeIfAbsent(e.target(), k -> new ArrayList<>()).add(e);
                }
            }
        }

        VariableResolution resolveVariable(String variableId) {
            VariableResolution cached = memo.get(variableId);
            if (cached != null) return cached;
            if (!visiting.add(variableId)) return VariableResolution.unknown(defaultOf(variableId));
            try {
                VariableResolution result = classify(variableId);
                memo.put(variableId, result);
                return result;
            } finally {
                visiting.remove(variableId);
            }
        }

        private VariableResolution classify(String variableId) {
            Object declaredDefault = defaultOf(variableId);
            List<Node> assignments = reachableAssignments.getOrDefault(variableId, List.of());
            if (assignments.isEmpty()) return VariableResolution.resolved(declaredDefault, null);
            if (assignments.stream().anyMatch(a -> cycleDependent.contains(a.id()))) {
                return VariableResolution.unknown(declaredDefault);
            }

            if (assignments.size() == 1) {
                Node only = assignments.get(0);
                VariableResolution produced = producedValue(only, variableId);
                return new VariableResolution(produced.currentValue(), only.id(), produced.status());
            }

            List<VariableResolution> produced = new ArrayList<>(assignments.size());
            for (Node a : assignments) produced.add(producedValue(a, variableId));
            if (produced.stream().anyMatch(p -> p.status() == ResolutionStatus.UNKNOWN)) {
                return VariableResolution.unknown(declaredDefault);
            }
            if (produced.stream().anyMatch(p -> p.status() == ResolutionStatus.AMBIGUOUS)) {
                return VariableResolution.ambiguous(declaredDefault);
            }
            Object first = produced.get(0).currentValue();
            boolean agree = produced.stream().allMatch(p -> ValueEquality.sameValue(first, p.currentValue()));
            return agree ? VariableResolution.resolved(first, null) : VariableResolution.ambiguous(declaredDefault);
        }

        /** The value one assignment node writes. The source node id is left empty. */
        private VariableResolution producedValue(Node assignment, String variableId) {
            Object declaredDefault = defaultOf(variableId);
            List<Edge> inputs = valueInputs.getOrDefault(assignment.id(), List.of());
            if (inputs.size() > 1) return VariableResolution.ambiguous(declaredDefault);
            if (inputs.size() == 1) {
                Node source = byId.get(inputs.get(0).source());
                String sourceVariable = source == null ? null : source.variableId().orElse(null);
                if (sourceVariable == null || !declarations.containsKey(sourceVariable)) {
                    return VariableResolution.unknown(sourceVariable == null ? null : defaultOf(sourceVariable));
                }
                VariableResolution upstream = resolveVariable(sourceVariable);
                return new VariableResolution(upstream.currentValue(), null, upstream.status());
            }
            VariableDeclaration declaration = declarations.get(variableId);
            String dataKind = declaration == null ? null : declaration.dataKind();
            return VariableResolution.resolved(ValueDefaults.effectiveManualValue(assignment, declaredDefault, dataKind), null);
        }

        private Object defaultOf(String variableId) {
            VariableDeclaration declaration = declarations.get(variableId);
            return declaration == null ? null : declaration.defaultValue();
        }
    }
}
