package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.ValidationException;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Closed set of accepted payment methods */
public enum PaymentMethod {
    CREDIT_CARD("credit_card"),
    DEBIT_CARD("debit_card"),
    PAYPAL("paypal"),
    BANK_TRANSFER("bank_transfer");

    private final String value;

    PaymentMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static PaymentMethod fromValue(String value) {
        for (PaymentMethod method : values()) {
            if (method.value.equals(value)) {
                return method;
            }
        }
        String allowed =
                Arrays.stream(values()).map(PaymentMethod::value).collect(Collectors.joining(", "));
        throw new ValidationException(
                "Invalid payment method: " + value + ". Must be one of: " + allowed, "payment_method");
    }
}
