package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.util.UUID;

/** Opaque notification identifier */
public record NotificationId(String value) {
    public NotificationId {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Notification ID cannot be empty", "notification_id");
        }
    }

    public static NotificationId generate() {
        return new NotificationId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
