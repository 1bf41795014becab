package com.acme.dispatch.command;

/**
 * Keys of the transport context map handed to every handler.
 */
public final class ContextKeys {

    // Common
    public static final String CORRELATION_ID = "correlation_id";

    // HTTP
    public static final String OPERATION = "operation";
    public static final String USER_ID = "user_id";
    public static final String PAYMENT_ID = "payment_id";
    public static final String REQUEST_ID = "request_id";

    // Queue
    public static final String QUEUE = "queue";
    public static final String MESSAGE_ID = "message_id";

    // Stream
    public static final String TOPIC = "topic";
    public static final String KEY = "key";
    public static final String PARTITION = "partition";
    public static final String OFFSET = "offset";

    private ContextKeys() {
        // Utility class - prevent instantiation
    }
}
