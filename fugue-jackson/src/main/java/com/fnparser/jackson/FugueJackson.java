package com.fnparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = FugueJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(expr);
 * </pre>
 */
public final class FugueJackson {

    private FugueJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper:
     * - Writes a {@code type} property first on every node
     * - Leaves out absent optional parts (annotations, suffixes, doc comments)
     * - Writes symbols as strings
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Optional AST parts are null when absent
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
