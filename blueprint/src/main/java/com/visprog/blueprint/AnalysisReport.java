package com.visprog.blueprint;

import com.visprog.blueprint.resolve.VariableResolution;
import com.visprog.blueprint.validation.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Validation plus variable preview for one snapshot. {@code variables} keeps declaration order. */
public record AnalysisReport(ValidationResult validation, Map<String, VariableResolution> variables) {

    public AnalysisReport {
        Objects.requireNonNull(validation, "validation");
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public boolean ok() {
        return validation.ok();
    }
}
