package com.acme.dispatch.domain.model;

import static org.assertj.core.api.Assertions.*;

import com.acme.dispatch.core.ErrorCodes;
import com.acme.dispatch.domain.exception.BusinessRuleViolationException;
import com.acme.dispatch.domain.exception.ValidationException;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for Payment aggregate */
class PaymentTest {

  private static Payment newPayment() {
    return Payment.create(
        new UserId("user-1"),
        Money.of("99.95", "USD"),
        PaymentMethod.CREDIT_CARD,
        "order-42",
        Map.of("channel", "web"));
  }

  private static Payment completedPayment() {
    Payment payment = newPayment();
    payment.markAsProcessing();
    payment.markAsCompleted(new TransactionId("txn_abc"));
    return payment;
  }

  @Nested
  @DisplayName("Construction")
  class ConstructionTests {

    @Test
    @DisplayName("Should start pending without transaction id")
    void testCreate() {
      Payment payment = newPayment();

      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
      assertThat(payment.getTransactionId()).isNull();
      assertThat(payment.getFailureReason()).isNull();
      assertThat(payment.getReference()).isEqualTo("order-42");
    }

    @Test
    @DisplayName("Should reject unknown payment method")
    void testUnknownMethod() {
      assertThatThrownBy(() -> PaymentMethod.fromValue("bitcoin"))
          .isInstanceOf(ValidationException.class)
          .hasMessageContaining("credit_card, debit_card, paypal, bank_transfer");
    }
  }

  @Nested
  @DisplayName("Status transitions")
  class TransitionTests {

    @Test
    @DisplayName("pending -> processing -> completed should set transaction id")
    void testHappyPath() {
      Payment payment = newPayment();

      payment.markAsProcessing();
      payment.markAsCompleted(new TransactionId("txn_123"));

      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
      assertThat(payment.getTransactionId().value()).isEqualTo("txn_123");
    }

    @Test
    @DisplayName("Should complete and fail directly from pending")
    void testFromPending() {
      Payment completed = newPayment();
      Payment failed = newPayment();

      completed.markAsCompleted(new TransactionId("txn_1"));
      failed.markAsFailed("declined");

      assertThat(completed.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
      assertThat(failed.getStatus()).isEqualTo(PaymentStatus.FAILED);
      assertThat(failed.getFailureReason()).isEqualTo("declined");
    }

    @Test
    @DisplayName("Completing clears an earlier failure reason")
    void testCompleteClearsReason() {
      Payment payment =
          new Payment(
              PaymentId.generate(),
              new UserId("user-1"),
              Money.of("5", "EUR"),
              PaymentMethod.PAYPAL,
              PaymentStatus.PROCESSING,
              null,
              null,
              "retrying",
              null,
              null,
              null);

      payment.markAsCompleted(new TransactionId("txn_9"));

      assertThat(payment.getFailureReason()).isNull();
    }

    @Test
    @DisplayName("Completing a completed payment is rejected and changes nothing")
    void testCompleteFromCompleted() {
      Payment payment = completedPayment();
      Instant updatedAt = payment.getUpdatedAt();

      assertThatThrownBy(() -> payment.markAsCompleted(new TransactionId("txn_other")))
          .isInstanceOf(BusinessRuleViolationException.class)
          .hasMessageStartingWith("Business rule violation: ");

      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
      assertThat(payment.getTransactionId().value()).isEqualTo("txn_abc");
      assertThat(payment.getUpdatedAt()).isEqualTo(updatedAt);
    }

    @Test
    @DisplayName("Failing a completed payment is rejected and changes nothing")
    void testFailFromCompleted() {
      Payment payment = completedPayment();
      Instant updatedAt = payment.getUpdatedAt();

      assertThatThrownBy(() -> payment.markAsFailed("too late"))
          .isInstanceOfSatisfying(
              BusinessRuleViolationException.class,
              e -> {
                assertThat(e.getErrorCode()).isEqualTo(ErrorCodes.BUSINESS_RULE_VIOLATION);
                assertThat(e.getRule()).isEqualTo("payment_status_transition");
              });

      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
      assertThat(payment.getFailureReason()).isNull();
      assertThat(payment.getUpdatedAt()).isEqualTo(updatedAt);
    }

    @Test
    @DisplayName("Processing is only reachable from pending")
    void testProcessingTwice() {
      Payment payment = newPayment();
      payment.markAsProcessing();

      assertThatThrownBy(payment::markAsProcessing)
          .isInstanceOf(BusinessRuleViolationException.class);
    }

    @Test
    @DisplayName("Refund is only allowed once completed")
    void testRefund() {
      Payment pending = newPayment();
      Payment completed = completedPayment();

      assertThatThrownBy(pending::refund).isInstanceOf(BusinessRuleViolationException.class);

      completed.refund();
      assertThat(completed.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
      assertThatThrownBy(completed::refund).isInstanceOf(BusinessRuleViolationException.class);
    }

    @Test
    @DisplayName("Failed payments cannot be completed")
    void testCompleteFromFailed() {
      Payment payment = newPayment();
      payment.markAsFailed("declined");

      assertThatThrownBy(() -> payment.markAsCompleted(new TransactionId("txn_1")))
          .isInstanceOf(BusinessRuleViolationException.class);
      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
    }
  }

  @Test
  @DisplayName("toMap/fromMap should preserve every field")
  void testMapRoundTrip() {
    Payment payment = completedPayment();

    Payment restored = Payment.fromMap(payment.toMap());

    assertThat(restored).usingRecursiveComparison().isEqualTo(payment);
    assertThat(payment.toMap()).containsEntry("status", "completed");
  }
}
