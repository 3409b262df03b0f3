package com.rfqlog.domain.exception;

/**
 * Raised by the history query when the audited entity does not exist
 */
public class NotFoundException extends RuntimeException {

    private final Long entityId;

    public NotFoundException(Long entityId) {
        super("Entity not found: " + entityId);
        this.entityId = entityId;
    }

    public Long getEntityId() {
        return entityId;
    }
}
