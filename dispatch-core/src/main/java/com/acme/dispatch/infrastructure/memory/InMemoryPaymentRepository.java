package com.acme.dispatch.infrastructure.memory;

import com.acme.dispatch.domain.exception.AlreadyExistsException;
import com.acme.dispatch.domain.exception.NotFoundException;
import com.acme.dispatch.domain.model.Payment;
import com.acme.dispatch.domain.model.PaymentId;
import com.acme.dispatch.domain.model.TransactionId;
import com.acme.dispatch.domain.repository.PaymentRepository;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryPaymentRepository implements PaymentRepository {
  private final Map<String, Map<String, Object>> payments = new HashMap<>();
  private final Map<String, String> transactionIndex = new HashMap<>();

  @Override
  public synchronized void create(Payment payment) {
    String id = payment.getPaymentId().value();
    if (payments.containsKey(id)) {
      throw new AlreadyExistsException("Payment", "payment_id=" + id);
    }
    checkTransactionId(payment);
    payments.put(id, payment.toMap());
    index(payment);
  }

  @Override
  public synchronized Optional<Payment> findById(PaymentId paymentId) {
    return Optional.ofNullable(payments.get(paymentId.value())).map(Payment::fromMap);
  }

  @Override
  public synchronized Optional<Payment> findByTransactionId(TransactionId transactionId) {
    return Optional.ofNullable(transactionIndex.get(transactionId.value()))
        .map(payments::get)
        .map(Payment::fromMap);
  }

  @Override
  public synchronized void update(Payment payment) {
    String id = payment.getPaymentId().value();
    if (!payments.containsKey(id)) {
      throw new NotFoundException("Payment", id);
    }
    checkTransactionId(payment);
    payments.put(id, payment.toMap());
    index(payment);
  }

  @Override
  public synchronized void delete(PaymentId paymentId) {
    Map<String, Object> removed = payments.remove(paymentId.value());
    if (removed == null) {
      throw new NotFoundException("Payment", paymentId.value());
    }
    Object transactionId = removed.get("transaction_id");
    if (transactionId != null) {
      transactionIndex.remove(transactionId.toString());
    }
  }

  public synchronized int size() {
    return payments.size();
  }

  private void checkTransactionId(Payment payment) {
    if (payment.getTransactionId() == null) {
      return;
    }
    String owner = transactionIndex.get(payment.getTransactionId().value());
    if (owner != null && !owner.equals(payment.getPaymentId().value())) {
      throw new AlreadyExistsException(
          "Payment", "transaction_id=" + payment.getTransactionId().value());
    }
  }

  private void index(Payment payment) {
    if (payment.getTransactionId() != null) {
      transactionIndex.put(payment.getTransactionId().value(), payment.getPaymentId().value());
    }
  }
}
