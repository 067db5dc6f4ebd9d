package com.visprog.blueprint.model;

import java.util.Objects;

/** @param defaultValue any JSON-like value (number, string, boolean, list, map) or {@code null} */
public record VariableDeclaration(String id, String name, String dataKind, Object defaultValue) {
    public VariableDeclaration {
        Objects.requireNonNull(id, "id");
        name = name == null ? id : name;
        dataKind = dataKind == null ? "any" : dataKind;
    }
}
