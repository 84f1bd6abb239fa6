package com.example.boundary.audit.exception;

/**
 * Raised by a ledger for failures worth retrying (connectivity, timeouts, failover).
 */
public class TransientLedgerException extends RuntimeException {

    public TransientLedgerException(String message) {
        super(message);
    }

    public TransientLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
