package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.util.UUID;

/** Opaque payment identifier */
public record PaymentId(String value) {
    public PaymentId {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Payment ID cannot be empty", "payment_id");
        }
    }

    public static PaymentId generate() {
        return new PaymentId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
