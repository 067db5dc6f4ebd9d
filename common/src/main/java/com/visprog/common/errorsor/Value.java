package com.visprog.common.errorsor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Value<T>(T value) implements ErrorsOr<T> {

    public Value {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isError() {
        return false;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.of(value);
    }

    @Override
    public List<String> getErrors() {
        return List.of();
    }

    @Override
    public String toString() {
        return "Value(" + value + ")";
    }
}
