package io.landledger.core.p2p;

import io.landledger.core.LedgerException;

/** A peer address with no usable host or port. */
public class InvalidAddressException extends LedgerException {
    public InvalidAddressException(String message) {
        super(message);
    }

    public InvalidAddressException(String message, Throwable cause) {
        super(message, cause);
    }
}
