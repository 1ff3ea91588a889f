package com.coopledger.common.exception;

/**
 * Base exception for all cooperative ledger exceptions.
 */
public class CooperativeException extends RuntimeException {

    public CooperativeException(String message) {
        super(message);
    }

    public CooperativeException(String message, Throwable cause) {
        super(message, cause);
    }
}
