package io.fieldledger.core;

/** Transient failure talking to the remote authority; retried with backoff. */
public class SyncTransportException extends LedgerException {
    public SyncTransportException(String message) {
        super(message);
    }

    public SyncTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
