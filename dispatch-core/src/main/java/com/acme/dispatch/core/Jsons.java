package com.acme.dispatch.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.HashMap;
import java.util.Map;

public final class Jsons {
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper M =
            new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                    .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private Jsons() {}

    /** Shared mapper; callers must not reconfigure it. */
    public static ObjectMapper mapper() {
        return M;
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new PermanentException("Failed to serialize " + o.getClass().getSimpleName(), e);
        }
    }

    /**
     * Parse a JSON object into a mutable map. A blank document yields an empty map; any other
     * document that is not an object, the literal {@code null} included, is a {@link
     * PermanentException}.
     */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new HashMap<>();
        }
        Map<String, Object> map;
        try {
            map = M.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            throw new PermanentException("Failed to parse JSON object", e);
        }
        if (map == null) {
            throw new PermanentException("JSON document is not an object");
        }
        return map;
    }
}
