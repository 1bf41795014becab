package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;

/** Notification target whose format depends on the delivery channel */
public record Recipient(String value, NotificationChannel channel) {
    public Recipient {
        if (channel == null) {
            throw new ValidationException("Channel cannot be null", "channel");
        }
        if (value == null || value.isBlank()) {
            throw new ValidationException("Recipient cannot be empty", "recipient");
        }
        switch (channel) {
            case EMAIL:
                if (!value.contains("@")) {
                    throw new ValidationException("Invalid email recipient: " + value, "recipient");
                }
                break;
            case SMS:
                String digits = value.replace("+", "").replace("-", "").replace(" ", "");
                if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
                    throw new ValidationException("Invalid phone number: " + value, "recipient");
                }
                break;
            default:
                break;
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
