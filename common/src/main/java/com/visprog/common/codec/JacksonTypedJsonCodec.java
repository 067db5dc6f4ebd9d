package com.visprog.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visprog.common.errorsor.ErrorsOr;

import java.util.Objects;

/** JSON codec for one concrete type. The mapper is private to the codec. */
public final class JacksonTypedJsonCodec<T> implements Codec<T, String> {
    private final ObjectMapper mapper;
    private final Class<T> klass;

    public JacksonTypedJsonCodec(ObjectMapper baseMapper, Class<T> klass) {
        this.mapper = Objects.requireNonNull(baseMapper).copy();
        this.mapper.findAndRegisterModules();
        this.klass = Objects.requireNonNull(klass);
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
