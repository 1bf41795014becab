package com.acme.dispatch.application.command;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RefundPaymentCommand(
        @JsonProperty("payment_id") String paymentId,
        String reason,
        @JsonProperty("correlation_id") String correlationId) {

    public RefundPaymentCommand {
        CommandPayloads.require(paymentId, "payment_id");
    }
}
