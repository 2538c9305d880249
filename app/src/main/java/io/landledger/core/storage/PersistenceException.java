package io.landledger.core.storage;

import io.landledger.core.LedgerException;

/**
 * A durable read or write failed. The in-memory ledger stays authoritative;
 * whatever was not written is lost if the process stops before the next
 * successful write.
 */
public class PersistenceException extends LedgerException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
