package com.acme.dispatch.spi;

import java.math.BigDecimal;

public interface PaymentGateway {
    /**
     * Charge the given amount. A declined charge is reported through {@link GatewayResult}; an
     * exception means the gateway could not be reached or answered garbage.
     */
    GatewayResult process(BigDecimal amount, String currency, String method, String reference);
}
