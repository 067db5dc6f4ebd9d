package com.visprog.blueprint.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum EdgeKind {
    CONTROL("execution"),
    DATA("data");

    private final String wireName;

    EdgeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Accepts the editor names ({@code execution}, {@code data}) and {@code control}, any case. */
    public static Optional<EdgeKind> fromWire(String name) {
        if (name == null) return Optional.empty();
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "execution", "control" -> Optional.of(CONTROL);
            case "data" -> Optional.of(DATA);
            default -> Optional.empty();
        };
    }
}
