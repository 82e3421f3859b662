package com.fintech.accountreconciliation.exception;

/**
 * Base exception for errors raised while preparing or running a reconciliation.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
