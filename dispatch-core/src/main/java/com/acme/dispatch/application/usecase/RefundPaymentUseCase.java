package com.acme.dispatch.application.usecase;

import com.acme.dispatch.application.command.RefundPaymentCommand;
import com.acme.dispatch.core.EventTypeConstants;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentId;
import com.acme.dispatch.domain.repository.PaymentRepository;
import com.acme.dispatch.spi.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@RequiredArgsConstructor
@Slf4j
public class RefundPaymentUseCase {
    private final PaymentRepository paymentRepository;
    private final EventPublisher eventPublisher;

    public Payment execute(RefundPaymentCommand command) {
        PaymentId paymentId = new PaymentId(command.paymentId());
        log.info("Refunding payment {}", paymentId);

        Payment payment = paymentRepository.findById(paymentId)
            .orElseThrow(() -> new NotFoundException("Payment", paymentId.value()));

        payment.refund();
        paymentRepository.update(payment);

        Map<String, Object> event = ProcessPaymentUseCase.completedEvent(payment);
        if (command.reason() != null) {
            event.put("reason", command.reason());
        }
        eventPublisher.publish(EventTypeConstants.PAYMENT_REFUNDED, event, command.correlationId());

        log.info("Payment {} refunded", paymentId);
        return payment;
    }
}
