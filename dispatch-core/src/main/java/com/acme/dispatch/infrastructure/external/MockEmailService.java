package com.acme.dispatch.infrastructure.external;

import com.acme.dispatch.core.ExternalServiceException;
import com.acme.dispatch.spi.EmailResult;
import com.acme.dispatch.spi.EmailService;
import java.util.Map;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stand-in email provider used when the configured api key is {@code mock_key}. */
public class MockEmailService implements EmailService {
  private static final Logger log = LoggerFactory.getLogger(MockEmailService.class);

  private final double outageRate;
  private final DoubleSupplier random;

  public MockEmailService() {
    this(0.0, Math::random);
  }

  /** @param outageRate share of sends that fail with an {@link ExternalServiceException} */
  public MockEmailService(double outageRate, DoubleSupplier random) {
    this.outageRate = outageRate;
    this.random = random;
  }

  @Override
  public EmailResult send(
      String recipient,
      String subject,
      String body,
      String templateId,
      Map<String, Object> variables) {
    if (random.getAsDouble() < outageRate) {
      throw new ExternalServiceException("EmailService", "Service temporarily unavailable");
    }
    String messageId = "msg_" + MockPaymentGateway.hex(8);
    log.info("Mock email sent to {}: {}", recipient, messageId);
    return EmailResult.sent(messageId);
  }
}
