package com.visprog.blueprint;

import com.visprog.blueprint.config.AnalysisConfig;
import com.visprog.blueprint.model.BlueprintSnapshot;
import com.visprog.blueprint.model.Graph;
import com.visprog.blueprint.model.VariableDeclaration;
import com.visprog.blueprint.registry.BlueprintNodeTC;
import com.visprog.blueprint.registry.DefaultBlueprintNodeTC;
import com.visprog.blueprint.resolve.VariableResolution;
import com.visprog.blueprint.resolve.VariableValueResolver;
import com.visprog.blueprint.validation.StructuralValidator;
import com.visprog.blueprint.validation.ValidationResult;
import com.visprog.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for callers: validation, variable preview, and the gate in front of code generation.
 * Stateless apart from its collaborators, so one instance may be shared.
 */
public final class BlueprintAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BlueprintAnalyzer.class);

    private final AnalysisConfig config;
    private final StructuralValidator validator;
    private final VariableValueResolver resolver;

    public BlueprintAnalyzer(BlueprintNodeTC ntc, AnalysisConfig config) {
        Objects.requireNonNull(ntc, "ntc");
        this.config = Objects.requireNonNull(config, "config");
        this.validator = new StructuralValidator(ntc);
        this.resolver = new VariableValueResolver(ntc);
    }

    public static BlueprintAnalyzer fromConfig(AnalysisConfig config) {
        return new BlueprintAnalyzer(new DefaultBlueprintNodeTC(config), config);
    }

    public ValidationResult validate(Graph graph) {
        return validator.validate(graph);
    }

    public Map<String, VariableResolution> resolve(Graph graph, List<VariableDeclaration> variables) {
        return resolver.resolve(graph, variables);
    }

    public AnalysisReport analyze(BlueprintSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        ValidationResult validation = validate(snapshot.graph());
        if (!validation.ok() && config.resolveOnlyWhenValid()) {
            return new AnalysisReport(validation, Map.of());
        }
        return new AnalysisReport(validation, resolve(snapshot.graph(), snapshot.variables()));
    }

    /** Runs {@code generator} only on a graph that validates; otherwise returns the validation errors. */
    public <T> ErrorsOr<T> generate(Graph graph, CodeGenerator<T> generator) {
        Objects.requireNonNull(generator, "generator");
        ValidationResult validation = validate(graph);
        if (!validation.ok()) {
            log.info("Code generation skipped: graph has {} error(s)", validation.errors().size());
            return ErrorsOr.errors(validation.errors());
        }
        return generator.generate(graph);
    }
}
