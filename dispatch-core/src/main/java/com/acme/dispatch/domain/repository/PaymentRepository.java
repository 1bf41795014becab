package com.acme.dispatch.domain.repository;

import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentId;
import com.acme.dispatch.domain.model.TransactionId;

import java.util.Optional;

/**
 * Repository interface for Payment aggregate. The gateway transaction id is the unique key.
 */
public interface PaymentRepository {
    void create(Payment payment);

    Optional<Payment> findById(PaymentId paymentId);

    Optional<Payment> findByTransactionId(TransactionId transactionId);

    void update(Payment payment);

    void delete(PaymentId paymentId);
}
