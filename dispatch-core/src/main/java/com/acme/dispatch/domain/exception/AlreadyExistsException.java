package com.acme.dispatch.domain.exception;

import com.acme.dispatch.core.ErrorCodes;

public class AlreadyExistsException extends DomainException {

    /**
     * @param entity entity name, e.g. {@code User}
     * @param identifier the clashing key in {@code name=value} form, e.g. {@code email=a@b.io}
     */
    public AlreadyExistsException(String entity, String identifier) {
        super(ErrorCodes.ALREADY_EXISTS, entity + " with " + identifier + " already exists");
    }
}
