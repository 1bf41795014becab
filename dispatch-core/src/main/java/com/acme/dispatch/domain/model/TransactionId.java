package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;

/** Identifier assigned by the payment gateway on a successful charge */
public record TransactionId(String value) {
    public TransactionId {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Transaction ID cannot be empty", "transaction_id");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
