package com.visprog.blueprint.resolve;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ResolutionStatus {
    /** A single value that every execution path agrees on. */
    RESOLVED,
    /** Reachable assignments disagree, or one assignment has several value inputs. */
    AMBIGUOUS,
    /** The value depends on a control-flow cycle, a recursive reference or an expression. */
    UNKNOWN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
