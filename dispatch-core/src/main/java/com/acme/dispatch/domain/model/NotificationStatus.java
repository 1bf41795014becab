package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;

public enum NotificationStatus {
    PENDING("pending"),
    SENT("sent"),
    DELIVERED("delivered"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    NotificationStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** No transition leaves a terminal status. */
    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED || this == CANCELLED;
    }

    public static NotificationStatus fromValue(String value) {
        for (NotificationStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new ValidationException("Unknown notification status: " + value, "status");
    }
}
