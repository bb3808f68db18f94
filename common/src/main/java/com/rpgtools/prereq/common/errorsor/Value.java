package com.rpgtools.prereq.common.errorsor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record Value<T>(T value) implements ErrorsOr<T> {
    public Value {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Optional<T> getValue() {
        return Optional.of(value);
    }

    @Override
    public List<String> getErrors() {
        return List.of();
    }
}
