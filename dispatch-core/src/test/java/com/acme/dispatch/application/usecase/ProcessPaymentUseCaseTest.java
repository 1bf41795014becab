package com.acme.dispatch.application.usecase;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.dispatch.application.command.ProcessPaymentCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.core.ExternalServiceException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.exception.ValidationException;
import com.acme.dispatch.domain.model.Email;
import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentStatus;
import com.acme.dispatch.domain.model.User;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.PaymentRepository;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.spi.GatewayResult;
import com.acme.dispatch.spi.PaymentGateway;
import com.acme.dispatch.support.RecordingEventPublisher;
import java.math.BigDecimal;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProcessPaymentUseCaseTest {

  @Mock private UserRepository userRepository;
  @Mock private PaymentRepository paymentRepository;
  @Mock private PaymentGateway gateway;

  private RecordingEventPublisher publisher;
  private ProcessPaymentUseCase useCase;
  private User user;

  @BeforeEach
  void setUp() {
    publisher = new RecordingEventPublisher();
    useCase = new ProcessPaymentUseCase(userRepository, paymentRepository, gateway, publisher);
    user = User.create("Payer", new Email("payer@example.com"), null, null);
  }

  private ProcessPaymentCommand command(String amount) {
    return new ProcessPaymentCommand(
        user.getUserId().value(), new BigDecimal(amount), "USD", "credit_card", "ref-1", null, "c-1");
  }

  @Nested
  @DisplayName("Gateway outcomes")
  class OutcomeTests {

    @BeforeEach
    void knownUser() {
      when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));
    }

    @Test
    @DisplayName("Approved charge completes the payment and publishes payment.completed")
    void testApproved() {
      when(gateway.process(any(), eq("USD"), eq("credit_card"), eq("ref-1")))
          .thenReturn(GatewayResult.approved("txn_0123456789ab"));

      Payment payment = useCase.execute(command("25.00"));

      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
      assertThat(payment.getTransactionId().value()).isEqualTo("txn_0123456789ab");
      verify(paymentRepository).create(payment);
      verify(paymentRepository, times(2)).update(payment);
      assertThat(publisher.eventsOfType(EventTypeConstants.PAYMENT_COMPLETED))
          .singleElement()
          .satisfies(
              e -> assertThat(e.data()).containsEntry("transaction_id", "txn_0123456789ab"));
    }

    @Test
    @DisplayName("Declined charge fails the payment and publishes payment.failed")
    void testDeclined() {
      when(gateway.process(any(), any(), any(), any()))
          .thenReturn(GatewayResult.declined("Insufficient funds"));

      Payment payment = useCase.execute(command("25.00"));

      assertThat(payment.getStatus()).isEqualTo(PaymentStatus.FAILED);
      assertThat(payment.getFailureReason()).isEqualTo("Insufficient funds");
      assertThat(publisher.eventsOfType(EventTypeConstants.PAYMENT_FAILED))
          .singleElement()
          .satisfies(e -> assertThat(e.data()).containsEntry("reason", "Insufficient funds"));
    }

    @Test
    @DisplayName("Decline without a reason uses the default reason")
    void testDeclinedWithoutReason() {
      when(gateway.process(any(), any(), any(), any())).thenReturn(GatewayResult.declined(null));

      Payment payment = useCase.execute(command("1"));

      assertThat(payment.getFailureReason())
          .isEqualTo(ProcessPaymentUseCase.DEFAULT_FAILURE_REASON);
    }

    @Test
    @DisplayName("Gateway exception marks the payment failed and is rethrown")
    void testGatewayException() {
      ExternalServiceException outage =
          new ExternalServiceException("PaymentGateway", "timeout");
      when(gateway.process(any(), any(), any(), any())).thenThrow(outage);
      ArgumentCaptor<Payment> updated = ArgumentCaptor.forClass(Payment.class);

      assertThatThrownBy(() -> useCase.execute(command("10"))).isSameAs(outage);

      verify(paymentRepository, times(2)).update(updated.capture());
      Payment last = updated.getValue();
      assertThat(last.getStatus()).isEqualTo(PaymentStatus.FAILED);
      assertThat(last.getFailureReason()).isEqualTo("Gateway error: " + outage.getMessage());
      assertThat(publisher.events()).isEmpty();
    }
  }

  @Test
  @DisplayName("Unknown user should raise NOT_FOUND and create nothing")
  void testUnknownUser() {
    when(userRepository.findById(new UserId("ghost"))).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                useCase.execute(
                    new ProcessPaymentCommand(
                        "ghost", BigDecimal.TEN, "USD", "paypal", null, null, null)))
        .isInstanceOf(NotFoundException.class)
        .hasMessage("User with ID ghost not found");

    verifyNoInteractions(paymentRepository, gateway);
  }

  @Test
  @DisplayName("Non-positive amount should raise VALIDATION_ERROR before any write")
  void testZeroAmount() {
    when(userRepository.findById(user.getUserId())).thenReturn(Optional.of(user));

    assertThatThrownBy(() -> useCase.execute(command("0")))
        .isInstanceOf(ValidationException.class);

    verifyNoInteractions(paymentRepository, gateway);
  }
}
