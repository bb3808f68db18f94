package com.rpgtools.prereq.common.errorsor;

import com.rpgtools.prereq.common.function.ThrowingSupplier;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of human-readable errors, for callers that would rather branch
 * than catch.
 */
public sealed interface ErrorsOr<T> permits Value, Error {

    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Runs {@code body}; an exception becomes the single error {@code "SimpleName: message"}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body) {
        return trying(body, e -> e.getClass().getSimpleName() + ": " + e.getMessage());
    }

    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> describe) {
        try {
            return lift(body.get());
        } catch (Exception e) {
            return error(describe.apply(e));
        }
    }

    default boolean isError() {
        return this instanceof Error;
    }

    default boolean isValue() {
        return this instanceof Value;
    }

    Optional<T> getValue();

    /** Empty for a value. */
    List<String> getErrors();

    default T valueOrThrow() {
        return getValue().orElseThrow(() -> new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        if (this instanceof Value<T> v) return lift(f.apply(v.value()));
        return errors(getErrors());
    }
}
