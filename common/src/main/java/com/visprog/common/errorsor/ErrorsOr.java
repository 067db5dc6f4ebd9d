package com.visprog.common.errorsor;

import com.visprog.common.function.ThrowingSupplier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Used wherever a failure is an expected outcome (a snapshot that does not parse, a graph that
 * does not validate) so callers get every problem at once instead of the first exception.
 */
public sealed interface ErrorsOr<T> permits Value, Error {

    boolean isError();

    Optional<T> getValue();

    List<String> getErrors();

    // --- Factories ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Value when {@code errors} is empty, otherwise all of them. */
    static <T> ErrorsOr<T> liftIfNoErrors(T value, List<String> errors) {
        return errors.isEmpty() ? lift(value) : errors(errors);
    }

    /** Runs {@code body}; an exception becomes an error rendered by {@code toMsg}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return lift(body.get());
        } catch (Exception e) {
            return error(toMsg.apply(e));
        }
    }

    /** All values if every input is a value, otherwise the concatenated errors in input order. */
    static <T> ErrorsOr<List<T>> sequence(List<ErrorsOr<T>> all) {
        List<T> values = new ArrayList<>(all.size());
        List<String> errors = new ArrayList<>();
        for (ErrorsOr<T> eo : all) {
            if (eo.isError()) errors.addAll(eo.getErrors());
            else values.add(eo.getValue().orElseThrow());
        }
        return liftIfNoErrors(values, errors);
    }

    // --- Extractors ---
    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    // --- Combinators ---
    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? errors(getErrors()) : f.apply(getValue().orElseThrow());
    }

    default ErrorsOr<T> addPrefixIfError(String prefix) {
        return isError() ? errors(getErrors().stream().map(e -> prefix + e).toList()) : this;
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }
}
