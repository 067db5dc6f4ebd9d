package com.visprog.blueprint.io;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Jackson settings shared by everything that reads editor files or writes reports. */
public interface BlueprintJson {

    static ObjectMapper base(ObjectMapper om) {
        return om
                // Editor files carry UI-only fields (position, size, colours)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)

                // Record constructors normalise missing fields
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, false)

                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, false)
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, false)

                // Hand-written fixtures and tables
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());
    }

    /** Mapper for reports. Variable maps keep declaration order. */
    static ObjectMapper report() {
        return base(new ObjectMapper())
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
