package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.util.UUID;

/** Opaque user identifier */
public record UserId(String value) {
    public UserId {
        if (value == null || value.isBlank()) {
            throw new ValidationException("User ID cannot be empty", "user_id");
        }
    }

    public static UserId generate() {
        return new UserId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
