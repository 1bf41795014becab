package com.acme.dispatch.application.usecase;

import com.acme.dispatch.application.command.ProcessPaymentCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Money;
import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentMethod;
import com.acme.dispatch.domain.model.TransactionId;
import com.acme.dispatch.domain.model.UserId;
import com.acme.dispatch.domain.repository.PaymentRepository;
import com.acme.dispatch.domain.repository.UserRepository;
import com.acme.dispatch.spi.EventPublisher;
import com.acme.dispatch.spi.GatewayResult;
import com.acme.dispatch.spi.PaymentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Charges a user through the payment gateway.
 *
 * <p>The payment is stored as pending, moved to processing, then completed or failed from the
 * gateway answer. A declined charge is a normal outcome and publishes {@code payment.failed}. An
 * exception from the gateway marks the payment failed and is rethrown.
 */
@RequiredArgsConstructor
@Slf4j
public class ProcessPaymentUseCase {
    static final String DEFAULT_FAILURE_REASON = "Payment processing failed";

    private final UserRepository userRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentGateway paymentGateway;
    private final EventPublisher eventPublisher;

    public Payment execute(ProcessPaymentCommand command) {
        UserId userId = new UserId(command.userId());
        log.info("Processing payment of {} {} for user {}",
            command.amount(), command.currency(), userId);

        if (userRepository.findById(userId).isEmpty()) {
            throw new NotFoundException("User", userId.value());
        }

        Money money = Money.of(command.amount(), command.currency());
        PaymentMethod method = PaymentMethod.fromValue(command.paymentMethod());

        Payment payment = Payment.create(
            userId, money, method, command.reference(), command.metadata());
        paymentRepository.create(payment);

        payment.markAsProcessing();
        paymentRepository.update(payment);

        GatewayResult result;
        try {
            result = paymentGateway.process(
                money.amount(), money.currency(), method.value(), command.reference());
        } catch (RuntimeException e) {
            log.error("Payment gateway call failed for payment {}", payment.getPaymentId(), e);
            payment.markAsFailed("Gateway error: " + e.getMessage());
            paymentRepository.update(payment);
            throw e;
        }

        if (result.success()) {
            payment.markAsCompleted(new TransactionId(result.transactionId()));
            paymentRepository.update(payment);
            eventPublisher.publish(
                EventTypeConstants.PAYMENT_COMPLETED, completedEvent(payment), command.correlationId());
            log.info("Payment {} completed with transaction {}",
                payment.getPaymentId(), payment.getTransactionId());
        } else {
            String reason = result.error() != null ? result.error() : DEFAULT_FAILURE_REASON;
            payment.markAsFailed(reason);
            paymentRepository.update(payment);
            eventPublisher.publish(
                EventTypeConstants.PAYMENT_FAILED,
                Map.of(
                    "payment_id", payment.getPaymentId().value(),
                    "user_id", userId.value(),
                    "reason", reason),
                command.correlationId());
            log.warn("Payment {} declined: {}", payment.getPaymentId(), reason);
        }

        return payment;
    }

    static Map<String, Object> completedEvent(Payment payment) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("payment_id", payment.getPaymentId().value());
        event.put("user_id", payment.getUserId().value());
        event.put("amount", payment.getMoney().amount());
        event.put("currency", payment.getMoney().currency());
        event.put("transaction_id",
            payment.getTransactionId() != null ? payment.getTransactionId().value() : null);
        return event;
    }
}
