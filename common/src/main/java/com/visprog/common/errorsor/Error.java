package com.visprog.common.errorsor;

import java.util.List;
import java.util.Optional;

public record Error<T>(List<String> errors) implements ErrorsOr<T> {

    public Error {
        errors = List.copyOf(errors);
        if (errors.isEmpty()) throw new IllegalArgumentException("Errors must not be empty");
    }

    @Override
    public boolean isError() {
        return true;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.empty();
    }

    @Override
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "Error(" + errors + ")";
    }
}
