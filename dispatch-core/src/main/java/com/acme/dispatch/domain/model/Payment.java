package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.BusinessRuleViolationException;
import com.acme.dispatch.domain.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Aggregate root for Payment.
 *
 * <p>Status moves {@code pending -> processing -> completed | failed} and {@code completed ->
 * refunded}. A rejected transition throws {@link BusinessRuleViolationException} before any field
 * is touched.
 */
@Getter
public class Payment {
    private static final String TRANSITION_RULE = "payment_status_transition";

    private final PaymentId paymentId;
    private final UserId userId;
    private final Money money;
    private final PaymentMethod paymentMethod;
    private final String reference;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private PaymentStatus status;
    private TransactionId transactionId;
    private String failureReason;
    private Instant updatedAt;

    public Payment(
            PaymentId paymentId,
            UserId userId,
            Money money,
            PaymentMethod paymentMethod,
            PaymentStatus status,
            TransactionId transactionId,
            String reference,
            String failureReason,
            Map<String, Object> metadata,
            Instant createdAt,
            Instant updatedAt) {
        if (paymentId == null) {
            throw new ValidationException("Payment ID cannot be null", "payment_id");
        }
        if (userId == null) {
            throw new ValidationException("User ID cannot be null", "user_id");
        }
        if (money == null) {
            throw new ValidationException("Money cannot be null", "amount");
        }
        if (paymentMethod == null) {
            throw new ValidationException("Payment method cannot be null", "payment_method");
        }

        this.paymentId = paymentId;
        this.userId = userId;
        this.money = money;
        this.paymentMethod = paymentMethod;
        this.status = status != null ? status : PaymentStatus.PENDING;
        this.transactionId = transactionId;
        this.reference = reference;
        this.failureReason = failureReason;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    public static Payment create(
            UserId userId,
            Money money,
            PaymentMethod paymentMethod,
            String reference,
            Map<String, Object> metadata) {
        Instant now = Instant.now();
        return new Payment(
                PaymentId.generate(),
                userId,
                money,
                paymentMethod,
                PaymentStatus.PENDING,
                null,
                reference,
                null,
                metadata,
                now,
                now);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void markAsProcessing() {
        if (status != PaymentStatus.PENDING) {
            throw transitionRejected("Can only mark pending payments as processing");
        }
        this.status = PaymentStatus.PROCESSING;
        touch();
    }

    public void markAsCompleted(TransactionId transactionId) {
        if (transactionId == null) {
            throw new ValidationException("Transaction ID cannot be null", "transaction_id");
        }
        if (!isOpen()) {
            throw transitionRejected("Cannot complete payment in status " + status.value());
        }
        this.status = PaymentStatus.COMPLETED;
        this.transactionId = transactionId;
        this.failureReason = null;
        touch();
    }

    public void markAsFailed(String reason) {
        if (!isOpen()) {
            throw transitionRejected("Cannot fail payment in status " + status.value());
        }
        this.status = PaymentStatus.FAILED;
        this.failureReason = reason;
        touch();
    }

    public void refund() {
        if (status != PaymentStatus.COMPLETED) {
            throw transitionRejected("Can only refund completed payments");
        }
        this.status = PaymentStatus.REFUNDED;
        touch();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("payment_id", paymentId.value());
        map.put("user_id", userId.value());
        map.put("amount", money.amount());
        map.put("currency", money.currency());
        map.put("payment_method", paymentMethod.value());
        map.put("status", status.value());
        map.put("transaction_id", transactionId != null ? transactionId.value() : null);
        map.put("reference", reference);
        map.put("failure_reason", failureReason);
        map.put("metadata", new HashMap<>(metadata));
        map.put("created_at", Attributes.iso(createdAt));
        map.put("updated_at", Attributes.iso(updatedAt));
        return map;
    }

    public static Payment fromMap(Map<String, Object> data) {
        String transactionId = Attributes.optionalString(data, "transaction_id");
        return new Payment(
                new PaymentId(Attributes.requireString(data, "payment_id")),
                new UserId(Attributes.requireString(data, "user_id")),
                Money.of(
                        new BigDecimal(Attributes.requireString(data, "amount")),
                        Attributes.requireString(data, "currency")),
                PaymentMethod.fromValue(Attributes.requireString(data, "payment_method")),
                PaymentStatus.fromValue(Attributes.requireString(data, "status")),
                transactionId != null ? new TransactionId(transactionId) : null,
                Attributes.optionalString(data, "reference"),
                Attributes.optionalString(data, "failure_reason"),
                Attributes.metadata(data),
                Attributes.instantOrNow(data, "created_at"),
                Attributes.optionalInstant(data, "updated_at"));
    }

    private boolean isOpen() {
        return status == PaymentStatus.PENDING || status == PaymentStatus.PROCESSING;
    }

    private BusinessRuleViolationException transitionRejected(String details) {
        return new BusinessRuleViolationException(TRANSITION_RULE, details);
    }

    private void touch() {
        this.updatedAt = Attributes.advance(updatedAt);
    }
}
