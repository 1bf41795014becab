package com.acme.dispatch.infrastructure.external;

import com.acme.dispatch.spi.GatewayResult;
import com.acme.dispatch.spi.PaymentGateway;
import java.math.BigDecimal;
import java.util.UUID;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-in gateway used when the configured api key is {@value #MOCK_API_KEY}. Approves every
 * charge unless a decline rate is set.
 */
public class MockPaymentGateway implements PaymentGateway {
  private static final Logger log = LoggerFactory.getLogger(MockPaymentGateway.class);

  public static final String MOCK_API_KEY = "mock_key";
  static final String DECLINE_REASON = "Insufficient funds";

  private final double declineRate;
  private final DoubleSupplier random;

  public MockPaymentGateway() {
    this(0.0, Math::random);
  }

  public MockPaymentGateway(double declineRate, DoubleSupplier random) {
    this.declineRate = declineRate;
    this.random = random;
  }

  @Override
  public GatewayResult process(
      BigDecimal amount, String currency, String method, String reference) {
    if (random.getAsDouble() < declineRate) {
      log.info("Mock payment declined for {} {}", amount, currency);
      return GatewayResult.declined(DECLINE_REASON);
    }
    String transactionId = "txn_" + hex(12);
    log.info("Mock payment processed: {} for {} {}", transactionId, amount, currency);
    return GatewayResult.approved(transactionId);
  }

  static String hex(int length) {
    return UUID.randomUUID().toString().replace("-", "").substring(0, length);
  }
}
