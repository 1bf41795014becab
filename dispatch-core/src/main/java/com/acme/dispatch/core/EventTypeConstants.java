package com.acme.dispatch.core;

/**
 * Central constants for domain event types. The prefix before the first dot selects the topic the
 * event is published to.
 */
public final class EventTypeConstants {

    // User events
    public static final String USER_CREATED = "user.created";
    public static final String USER_UPDATED = "user.updated";
    public static final String USER_DELETED = "user.deleted";

    // Payment events
    public static final String PAYMENT_COMPLETED = "payment.completed";
    public static final String PAYMENT_FAILED = "payment.failed";
    public static final String PAYMENT_REFUNDED = "payment.refunded";

    // Notification events
    public static final String NOTIFICATION_SENT = "notification.sent";
    public static final String NOTIFICATION_FAILED = "notification.failed";

    private EventTypeConstants() {
        // Utility class - prevent instantiation
    }
}
