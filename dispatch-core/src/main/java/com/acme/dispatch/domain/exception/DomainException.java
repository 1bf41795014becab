package com.acme.dispatch.domain.exception;

import com.acme.dispatch.core.DispatchException;

/** Error raised by entities, value objects and use cases when a business expectation is not met. */
public abstract class DomainException extends DispatchException {

    protected DomainException(String errorCode, String message) {
        super(errorCode, message);
    }
}
