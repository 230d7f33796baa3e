package io.fieldledger.core.conflict;

import io.fieldledger.core.LedgerException;

/** The policy table is incomplete or inconsistent; raised while loading it. */
public class PolicyConfigurationException extends LedgerException {
    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
