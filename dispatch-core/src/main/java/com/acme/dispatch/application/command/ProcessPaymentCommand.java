package com.acme.dispatch.application.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Command to charge a user through the payment gateway
 */
public record ProcessPaymentCommand(
        @JsonProperty("user_id") String userId,
        BigDecimal amount,
        String currency,
        @JsonProperty("payment_method") String paymentMethod,
        String reference,
        Map<String, Object> metadata,
        @JsonProperty("correlation_id") String correlationId) {

    public ProcessPaymentCommand {
        CommandPayloads.require(userId, "user_id");
        CommandPayloads.require(amount, "amount");
        CommandPayloads.require(currency, "currency");
        CommandPayloads.require(paymentMethod, "payment_method");
        metadata = metadata != null ? CommandPayloads.copyOf(metadata) : Map.of();
    }
}
