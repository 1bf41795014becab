package com.acme.dispatch.command;

/**
 * Operation names used as the first half of a registry key.
 */
public final class Operations {

    public static final String CREATE_USER = "create_user";
    public static final String UPDATE_USER = "update_user";
    public static final String DELETE_USER = "delete_user";
    public static final String PROCESS_PAYMENT = "process_payment";
    public static final String REFUND_PAYMENT = "refund_payment";
    public static final String SEND_NOTIFICATION = "send_notification";

    private Operations() {
        // Utility class - prevent instantiation
    }
}
