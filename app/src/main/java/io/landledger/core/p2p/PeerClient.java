package io.landledger.core.p2p;

import io.landledger.core.protocol.ChainMessage;
import io.landledger.core.protocol.Transaction;

import java.util.List;

/** Read-only view of another node, addressed by canonical {@code host:port}. */
public interface PeerClient {

    /** The peer's full chain as it reports it. */
    ChainMessage fetchChain(String peer) throws PeerUnavailableException;

    /** The peer's pending transactions. */
    List<Transaction> fetchMempool(String peer) throws PeerUnavailableException;
}
