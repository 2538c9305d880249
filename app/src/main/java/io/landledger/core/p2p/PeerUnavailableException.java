package io.landledger.core.p2p;

import io.landledger.core.LedgerException;

/**
 * A peer could not be reached in time, answered with an error status, or sent
 * something that does not decode. The peer is skipped until the next cycle.
 */
public class PeerUnavailableException extends LedgerException {
    private final String peer;

    public PeerUnavailableException(String peer, String message, Throwable cause) {
        super(message, cause);
        this.peer = peer;
    }

    public PeerUnavailableException(String peer, String message) {
        super(message);
        this.peer = peer;
    }

    public String peer() { return peer; }
}
