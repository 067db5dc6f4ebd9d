package com.visprog.blueprint.resolve;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * What one variable statically holds after the program has run.
 *
 * @param currentValue the value, or the declared default when nothing better is known; may be {@code null}
 * @param sourceNodeId the single assignment node that produced the value, {@code null} when there is none
 */
public record VariableResolution(Object currentValue,
                                 @JsonInclude(JsonInclude.Include.NON_NULL) String sourceNodeId,
                                 ResolutionStatus status) {

    public VariableResolution {
        Objects.requireNonNull(status, "status");
    }

    static VariableResolution unknown(Object value) {
        return new VariableResolution(value, null, ResolutionStatus.UNKNOWN);
    }

    static VariableResolution ambiguous(Object value) {
        return new VariableResolution(value, null, ResolutionStatus.AMBIGUOUS);
    }

    static VariableResolution resolved(Object value, String sourceNodeId) {
        return new VariableResolution(value, sourceNodeId, ResolutionStatus.RESOLVED);
    }
}
