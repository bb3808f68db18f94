package com.rpgtools.prereq.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpgtools.prereq.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON text to and from one bound type. The mapper is copied so later changes to the original do not leak in. */
final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.klass = Objects.requireNonNull(klass, "klass");
        this.mapper = Objects.requireNonNull(baseMapper, "baseMapper").copy().findAndRegisterModules();
    }

    @Override
    public ErrorsOr<String> encode(T value) {
        return ErrorsOr.trying(() -> mapper.writeValueAsString(value),
                e -> "Failed to encode " + klass.getSimpleName() + " to JSON: " + e.getMessage());
    }

    @Override
    public ErrorsOr<T> decode(String json) {
        return ErrorsOr.trying(() -> mapper.readValue(json, klass),
                e -> "Failed to decode " + klass.getSimpleName() + " from JSON: " + e.getMessage());
    }
}
