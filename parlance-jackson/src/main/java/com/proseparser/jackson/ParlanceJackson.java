package com.proseparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for ObjectMapper instances that read and write program trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ParlanceJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(program);
 * Program program = mapper.readValue(json, Program.class);
 * </pre>
 */
public final class ParlanceJackson {

    private ParlanceJackson() {
        // Utility class
    }

    /**
     * Creates a mapper with {@link AstModule} registered. Nulls are left out except where a
     * mixin asks for them, unknown properties are ignored, and integer literals read back
     * as {@code Long} (or {@code BigInteger} when they do not fit).
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.USE_LONG_FOR_INTS, true);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
