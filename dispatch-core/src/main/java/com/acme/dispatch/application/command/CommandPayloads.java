package com.acme.dispatch.application.command;

import com.acme.dispatch.core.Jsons;
import com.acme.dispatch.domain.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Binds loosely typed payload maps to command records. Unknown fields, missing required fields and
 * values of the wrong type all surface as {@link ValidationException} naming the field.
 */
public final class CommandPayloads {

    private CommandPayloads() {}

    public static <T> T bind(Map<String, Object> data, Class<T> commandType) {
        try {
            return Jsons.mapper().convertValue(data != null ? data : Map.of(), commandType);
        } catch (IllegalArgumentException e) {
            throw translate(e);
        }
    }

    static void require(Object value, String field) {
        if (value == null) {
            throw new ValidationException("Missing required field: " + field, field);
        }
    }

    static Map<String, Object> copyOf(Map<String, Object> map) {
        return map != null ? Collections.unmodifiableMap(new HashMap<>(map)) : null;
    }

    private static ValidationException translate(IllegalArgumentException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ValidationException) {
                return (ValidationException) t;
            }
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof UnrecognizedPropertyException) {
                String field = ((UnrecognizedPropertyException) t).getPropertyName();
                return new ValidationException("Unknown field: " + field, field);
            }
            if (t instanceof JsonMappingException) {
                String field = lastField((JsonMappingException) t);
                return field != null
                        ? new ValidationException("Invalid value for field: " + field, field)
                        : new ValidationException("Invalid command payload");
            }
        }
        return new ValidationException("Invalid command payload");
    }

    private static String lastField(JsonMappingException e) {
        String field = null;
        for (JsonMappingException.Reference ref : e.getPath()) {
            if (ref.getFieldName() != null) {
                field = ref.getFieldName();
            }
        }
        return field;
    }
}
