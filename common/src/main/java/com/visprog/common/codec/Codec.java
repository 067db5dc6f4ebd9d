package com.visprog.common.codec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.visprog.common.errorsor.ErrorsOr;

public interface Codec<From, To> {

    ErrorsOr<To> encode(From from);

    ErrorsOr<From> decode(To to);

    /** JSON codec for {@code klass}, starting from a copy of {@code baseMapper}. */
    static <T> Codec<T, String> clazzCodec(ObjectMapper baseMapper, Class<T> klass) {
        return new JacksonTypedJsonCodec<>(baseMapper, klass);
    }
}
