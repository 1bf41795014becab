package com.acme.dispatch.domain.exception;

import com.acme.dispatch.core.ErrorCodes;

public class NotFoundException extends DomainException {
    private final String entity;
    private final String entityId;

    public NotFoundException(String entity, String entityId) {
        super(ErrorCodes.NOT_FOUND, entity + " with ID " + entityId + " not found");
        this.entity = entity;
        this.entityId = entityId;
    }

    public String getEntity() {
        return entity;
    }

    public String getEntityId() {
        return entityId;
    }
}
