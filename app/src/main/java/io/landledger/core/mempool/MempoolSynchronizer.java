package io.landledger.core.mempool;

import io.landledger.core.metrics.SyncMetrics;
import io.landledger.core.node.Node;
import io.landledger.core.p2p.PeerClient;
import io.landledger.core.p2p.PeerUnavailableException;
import io.landledger.core.protocol.Transaction;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Pulls every peer's pending transactions into the local mempool. */
public final class MempoolSynchronizer {
    private static final Logger LOG = Logger.getLogger(MempoolSynchronizer.class.getName());

    private final Node node;
    private final PeerClient client;

    public MempoolSynchronizer(Node node, PeerClient client) {
        this.node = node;
        this.client = client;
    }

    /** @return how many transactions were added across all peers */
    public int synchronize() {
        int total = 0;
        for (String peer : node.peers().list()) {
            List<Transaction> remote;
            try {
                remote = client.fetchMempool(peer);
            } catch (PeerUnavailableException e) {
                SyncMetrics.recordPeerFetchFailure();
                LOG.log(Level.FINE, "Skipping peer " + peer + " for mempool sync", e);
                continue;
            }
            int added = node.mergeRemoteTransactions(remote);
            if (added > 0) {
                SyncMetrics.recordMerged(added);
                LOG.info(() -> "Merged " + added + " pending transactions from " + peer);
            }
            total += added;
        }
        return total;
    }
}
