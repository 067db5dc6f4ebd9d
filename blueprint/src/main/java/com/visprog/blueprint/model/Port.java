package com.visprog.blueprint.model;

import java.util.Objects;

/**
 * A node input or output.
 *
 * @param dataKind   {@link #CONTROL_DATA_KIND} for execution pins, anything else is a data kind
 * @param variableId variable bound through this port, or {@code null}
 */
public record Port(String id, String dataKind, String variableId) {

    public static final String CONTROL_DATA_KIND = "execution";

    public Port {
        Objects.requireNonNull(id, "id");
        dataKind = dataKind == null ? "any" : dataKind;
    }

    public static Port control(String id) {
        return new Port(id, CONTROL_DATA_KIND, null);
    }

    public static Port data(String id, String dataKind) {
        return new Port(id, dataKind, null);
    }
}
