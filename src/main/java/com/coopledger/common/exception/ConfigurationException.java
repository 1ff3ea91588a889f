package com.coopledger.common.exception;

/**
 * Thrown when required reference data is missing: an organization ledger account,
 * an interest rate for a term or an active credit rating scheme.
 */
public class ConfigurationException extends CooperativeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
