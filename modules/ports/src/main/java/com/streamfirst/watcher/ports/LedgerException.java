package com.streamfirst.watcher.ports;

/**
 * Thrown when the local ledger cannot report its block count.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
