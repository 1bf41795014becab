package com.acme.dispatch.domain.model;

import com.acme.dispatch.domain.exception.BusinessRuleViolationException;
import com.acme.dispatch.domain.exception.ValidationException;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Aggregate root for Notification.
 *
 * <p>Status moves {@code pending -> sent | failed}, {@code sent -> delivered}, and {@code pending ->
 * cancelled}. Sent and delivered notifications cannot be cancelled.
 */
@Getter
public class Notification {
    private static final String TRANSITION_RULE = "notification_status_transition";

    private final NotificationId notificationId;
    private final Recipient recipient;
    private final NotificationContent content;
    private final UserId userId;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private NotificationStatus status;
    private String externalId;
    private String failureReason;
    private Instant sentAt;
    private Instant updatedAt;

    public Notification(
            NotificationId notificationId,
            Recipient recipient,
            NotificationContent content,
            UserId userId,
            NotificationStatus status,
            String externalId,
            String failureReason,
            Map<String, Object> metadata,
            Instant sentAt,
            Instant createdAt,
            Instant updatedAt) {
        if (notificationId == null) {
            throw new ValidationException("Notification ID cannot be null", "notification_id");
        }
        if (recipient == null) {
            throw new ValidationException("Recipient cannot be null", "recipient");
        }
        if (content == null) {
            throw new ValidationException("Content cannot be null", "content");
        }

        this.notificationId = notificationId;
        this.recipient = recipient;
        this.content = content;
        this.userId = userId;
        this.status = status != null ? status : NotificationStatus.PENDING;
        this.externalId = externalId;
        this.failureReason = failureReason;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.sentAt = sentAt;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    public static Notification create(
            Recipient recipient,
            NotificationContent content,
            UserId userId,
            Map<String, Object> metadata) {
        Instant now = Instant.now();
        return new Notification(
                NotificationId.generate(),
                recipient,
                content,
                userId,
                NotificationStatus.PENDING,
                null,
                null,
                metadata,
                null,
                now,
                now);
    }

    public NotificationChannel getChannel() {
        return recipient.channel();
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void markAsSent(String externalId) {
        if (status != NotificationStatus.PENDING) {
            throw transitionRejected("Cannot mark notification as sent from status " + status.value());
        }
        this.status = NotificationStatus.SENT;
        this.externalId = externalId;
        this.failureReason = null;
        this.sentAt = Attributes.advance(updatedAt);
        this.updatedAt = sentAt;
    }

    public void markAsFailed(String reason) {
        if (status != NotificationStatus.PENDING) {
            throw transitionRejected(
                    "Cannot mark notification as failed from status " + status.value());
        }
        this.status = NotificationStatus.FAILED;
        this.failureReason = reason;
        touch();
    }

    public void markAsDelivered() {
        if (status != NotificationStatus.SENT) {
            throw transitionRejected("Can only mark sent notifications as delivered");
        }
        this.status = NotificationStatus.DELIVERED;
        touch();
    }

    public void cancel() {
        if (status == NotificationStatus.SENT || status == NotificationStatus.DELIVERED) {
            throw transitionRejected("Cannot cancel already sent notifications");
        }
        if (status.isTerminal()) {
            throw transitionRejected("Cannot cancel notification in status " + status.value());
        }
        this.status = NotificationStatus.CANCELLED;
        touch();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("notification_id", notificationId.value());
        map.put("recipient", recipient.value());
        map.put("channel", recipient.channel().value());
        map.put("subject", content.subject());
        map.put("body", content.body());
        map.put("template_id", content.templateId());
        map.put("user_id", userId != null ? userId.value() : null);
        map.put("status", status.value());
        map.put("external_id", externalId);
        map.put("failure_reason", failureReason);
        map.put("metadata", new HashMap<>(metadata));
        map.put("sent_at", Attributes.iso(sentAt));
        map.put("created_at", Attributes.iso(createdAt));
        map.put("updated_at", Attributes.iso(updatedAt));
        return map;
    }

    public static Notification fromMap(Map<String, Object> data) {
        String userId = Attributes.optionalString(data, "user_id");
        return new Notification(
                new NotificationId(Attributes.requireString(data, "notification_id")),
                new Recipient(
                        Attributes.requireString(data, "recipient"),
                        NotificationChannel.fromValue(Attributes.requireString(data, "channel"))),
                new NotificationContent(
                        Attributes.requireString(data, "subject"),
                        Attributes.requireString(data, "body"),
                        Attributes.optionalString(data, "template_id")),
                userId != null ? new UserId(userId) : null,
                NotificationStatus.fromValue(Attributes.requireString(data, "status")),
                Attributes.optionalString(data, "external_id"),
                Attributes.optionalString(data, "failure_reason"),
                Attributes.metadata(data),
                Attributes.optionalInstant(data, "sent_at"),
                Attributes.instantOrNow(data, "created_at"),
                Attributes.optionalInstant(data, "updated_at"));
    }

    private BusinessRuleViolationException transitionRejected(String details) {
        return new BusinessRuleViolationException(TRANSITION_RULE, details);
    }

    private void touch() {
        this.updatedAt = Attributes.advance(updatedAt);
    }
}
