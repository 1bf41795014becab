package com.acme.dispatch.application.usecase;

import static org.assertj.core.api.Assertions.*;

import com.acme.dispatch.application.command.RefundPaymentCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.exception.BusinessRuleViolationException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Money;
import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentMethod;
import com.acme.dispatch.domain.model.PaymentStatus;
import com.acme.dispatch.domain.model.TransactionId;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.infrastructure.memory.InMemoryPaymentRepository;
import com.acme.dispatch.support.RecordingEventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RefundPaymentUseCaseTest {

  private InMemoryPaymentRepository payments;
  private RecordingEventPublisher publisher;
  private RefundPaymentUseCase useCase;

  @BeforeEach
  void setUp() {
    payments = new InMemoryPaymentRepository();
    publisher = new RecordingEventPublisher();
    useCase = new RefundPaymentUseCase(payments, publisher);
  }

  private Payment stored(boolean completed) {
    Payment payment =
        Payment.create(new UserId("u-1"), Money.of("40", "EUR"), PaymentMethod.PAYPAL, null, null);
    if (completed) {
      payment.markAsCompleted(new TransactionId("txn_refund"));
    }
    payments.create(payment);
    return payment;
  }

  @Test
  @DisplayName("Completed payment is refunded and payment.refunded published")
  void testRefund() {
    Payment payment = stored(true);

    Payment refunded =
        useCase.execute(
            new RefundPaymentCommand(payment.getPaymentId().value(), "customer request", "c-3"));

    assertThat(refunded.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
    assertThat(payments.findById(payment.getPaymentId()).orElseThrow().getStatus())
        .isEqualTo(PaymentStatus.REFUNDED);
    assertThat(publisher.eventsOfType(EventTypeConstants.PAYMENT_REFUNDED))
        .singleElement()
        .satisfies(e -> assertThat(e.data()).containsEntry("reason", "customer request"));
  }

  @Test
  @DisplayName("Pending payment cannot be refunded")
  void testRefundPending() {
    Payment payment = stored(false);

    assertThatThrownBy(
            () ->
                useCase.execute(
                    new RefundPaymentCommand(payment.getPaymentId().value(), null, null)))
        .isInstanceOf(BusinessRuleViolationException.class);

    assertThat(payments.findById(payment.getPaymentId()).orElseThrow().getStatus())
        .isEqualTo(PaymentStatus.PENDING);
    assertThat(publisher.events()).isEmpty();
  }

  @Test
  @DisplayName("Unknown payment raises NOT_FOUND")
  void testUnknownPayment() {
    assertThatThrownBy(() -> useCase.execute(new RefundPaymentCommand("pay-x", null, null)))
        .isInstanceOf(NotFoundException.class);
  }
}
