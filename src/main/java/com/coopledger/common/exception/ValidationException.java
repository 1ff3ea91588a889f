package com.coopledger.common.exception;

/**
 * Thrown when caller input is rejected: bad amounts, mismatched totals,
 * duplicates, limits exceeded or edit windows closed.
 */
public class ValidationException extends CooperativeException {

    public ValidationException(String message) {
        super(message);
    }
}
