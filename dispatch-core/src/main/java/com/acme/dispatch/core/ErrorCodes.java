package com.acme.dispatch.core;

/**
 * Stable error codes returned in every failed result, whatever the transport.
 */
public final class ErrorCodes {

    // Domain errors
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String ALREADY_EXISTS = "ALREADY_EXISTS";
    public static final String BUSINESS_RULE_VIOLATION = "BUSINESS_RULE_VIOLATION";

    // Dispatch errors
    public static final String HANDLER_NOT_FOUND = "HANDLER_NOT_FOUND";
    public static final String TRANSPORT_NOT_SUPPORTED = "TRANSPORT_NOT_SUPPORTED";
    public static final String INVALID_OPERATION = "INVALID_OPERATION";
    public static final String DUPLICATE_REQUEST = "DUPLICATE_REQUEST";

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ErrorCodes() {
        // Utility class - prevent instantiation
    }
}
