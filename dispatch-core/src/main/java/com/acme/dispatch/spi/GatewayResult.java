package com.acme.dispatch.spi;

public record GatewayResult(boolean success, String transactionId, String error) {

    public static GatewayResult approved(String transactionId) {
        return new GatewayResult(true, transactionId, null);
    }

    public static GatewayResult declined(String error) {
        return new GatewayResult(false, null, error);
    }
}
