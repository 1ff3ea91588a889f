package com.coopledger.common.exception;

/**
 * Thrown when attempting an operation on an entity in a state that does not allow it.
 */
public class InvalidStateException extends CooperativeException {

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String entityType, String id, String currentState, String operation) {
        super(String.format("Cannot perform operation '%s' on %s %s in state %s",
            operation, entityType, id, currentState));
    }
}
