package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.util.Arrays;
import java.util.stream.Collectors;

public enum NotificationChannel {
    EMAIL("email"),
    SMS("sms"),
    PUSH("push"),
    WEBHOOK("webhook");

    private final String value;

    NotificationChannel(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static NotificationChannel fromValue(String value) {
        for (NotificationChannel channel : values()) {
            if (channel.value.equals(value)) {
                return channel;
            }
        }
        String allowed =
                Arrays.stream(values()).map(NotificationChannel::value).collect(Collectors.joining(", "));
        throw new ValidationException(
                "Invalid channel: " + value + ". Must be one of: " + allowed, "channel");
    }
}
