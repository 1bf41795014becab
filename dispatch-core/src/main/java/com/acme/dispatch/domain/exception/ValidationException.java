package com.acme.dispatch.domain.exception;

import com.acme.dispatch.core.ErrorCodes;

/** Input has the wrong shape or is out of range. */
public class ValidationException extends DomainException {
    private final String field;

    public ValidationException(String message) {
        this(message, null);
    }

    public ValidationException(String message, String field) {
        super(ErrorCodes.VALIDATION_ERROR, message);
        this.field = field;
    }

    /** Offending field name, or {@code null} when the error is not tied to one field. */
    public String getField() {
        return field;
    }
}
