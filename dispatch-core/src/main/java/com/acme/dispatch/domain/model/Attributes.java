package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/** Typed reads from the plain maps that entities are serialized to. */
final class Attributes {

    private Attributes() {}

    static String requireString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            throw new ValidationException("Missing required field: " + key, key);
        }
        return value.toString();
    }

    static String optionalString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    static Integer optionalInteger(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number != Math.rint(number)
                    || number > Integer.MAX_VALUE
                    || number < Integer.MIN_VALUE) {
                throw new ValidationException("Invalid integer for " + key + ": " + value, key);
            }
            return ((Number) value).intValue();
        }
        try {
            return Integer.valueOf(value.toString());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid integer for " + key + ": " + value, key);
        }
    }

    static Instant instantOrNow(Map<String, Object> data, String key) {
        Instant instant = optionalInstant(data, key);
        return instant != null ? instant : Instant.now();
    }

    static Instant optionalInstant(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid timestamp for " + key + ": " + value, key);
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> metadata(Map<String, Object> data) {
        Object value = data.get("metadata");
        if (value == null) {
            return new HashMap<>();
        }
        if (!(value instanceof Map)) {
            throw new ValidationException("Metadata must be an object", "metadata");
        }
        return new HashMap<>((Map<String, Object>) value);
    }

    static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    /** Later of now and the previous stamp, so an entity's clock never runs backwards. */
    static Instant advance(Instant previous) {
        Instant now = Instant.now();
        return previous != null && previous.isAfter(now) ? previous : now;
    }
}
