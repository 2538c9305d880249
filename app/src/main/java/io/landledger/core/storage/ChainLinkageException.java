package io.landledger.core.storage;

import io.landledger.core.LedgerException;

/** An append that does not extend the current head. The block is discarded. */
public class ChainLinkageException extends LedgerException {
    private final long expectedIndex;
    private final long actualIndex;

    public ChainLinkageException(String message, long expectedIndex, long actualIndex) {
        super(message);
        this.expectedIndex = expectedIndex;
        this.actualIndex = actualIndex;
    }

    public long expectedIndex() { return expectedIndex; }
    public long actualIndex() { return actualIndex; }
}
