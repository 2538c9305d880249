package io.landledger.core;

/**
 * Base type for the ledger's failure kinds. Unchecked, like the rest of the
 * validation errors in this codebase; callers that care catch the subtype.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
