package com.rpgtools.prereq.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rpgtools.prereq.common.errorsor.ErrorsOr;

/**
 * Two-way conversion that reports failures as {@link ErrorsOr} rather than throwing.
 * Implementations should make {@code decode(encode(x))} equal {@code x} for every encodable value.
 */
public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    /** JSON text codec for a Jackson-bindable type, on a default mapper. */
    static <T> Codec<T, String> clazzCodec(Class<T> klass) {
        return new JacksonTypedJsonCodec<>(new ObjectMapper(), klass);
    }

    static <T> Codec<T, String> clazzCodec(ObjectMapper mapper, Class<T> klass) {
        return new JacksonTypedJsonCodec<>(mapper, klass);
    }
}
