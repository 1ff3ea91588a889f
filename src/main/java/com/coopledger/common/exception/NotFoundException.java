package com.coopledger.common.exception;

/**
 * Thrown when a referenced entity does not exist.
 */
public class NotFoundException extends CooperativeException {

    public NotFoundException(String entityType, String id) {
        super(entityType + " not found: " + id);
    }
}
