package io.landledger.core.consensus;

import io.landledger.core.metrics.SyncMetrics;
import io.landledger.core.node.Node;
import io.landledger.core.p2p.PeerClient;
import io.landledger.core.p2p.PeerUnavailableException;
import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.ChainMessage;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Longest valid chain rule.
 *
 * Every registered peer is asked for its chain. A peer that cannot be reached
 * or answers garbage is skipped. Among the chains that pass
 * {@link ChainValidator}, the first one strictly longer than everything seen
 * so far (the local chain included) wins; equal length never replaces.
 *
 * Peers are trusted: a peer that builds a longer, internally consistent chain
 * will be followed.
 */
public final class ConsensusResolver {
    private static final Logger LOG = Logger.getLogger(ConsensusResolver.class.getName());

    private final Node node;
    private final PeerClient client;
    // the HTTP resolve endpoint and the background cycle share one resolver
    private final ReentrantLock resolveLock = new ReentrantLock();

    public ConsensusResolver(Node node, PeerClient client) {
        this.node = node;
        this.client = client;
    }

    /** @return true when the local chain was replaced */
    public boolean resolve() {
        resolveLock.lock();
        try {
            return resolveWithPeers();
        } finally {
            resolveLock.unlock();
        }
    }

    private boolean resolveWithPeers() {
        long maxLength = node.chainLength();
        List<Block> best = null;
        String bestPeer = null;

        for (String peer : node.peers().list()) {
            ChainMessage reply;
            try {
                reply = client.fetchChain(peer);
            } catch (PeerUnavailableException e) {
                SyncMetrics.recordPeerFetchFailure();
                LOG.log(Level.FINE, "Skipping peer " + peer + " for chain sync", e);
                continue;
            }
            if (reply.length() <= maxLength) {
                continue;
            }
            ValidationResult result = node.validator().validate(reply);
            if (!result.ok) {
                SyncMetrics.recordRejectedChain();
                LOG.info(() -> "Discarding chain from " + peer + ": " + result);
                continue;
            }
            maxLength = reply.length();
            best = reply.chain();
            bestPeer = peer;
        }

        if (best == null) {
            return false;
        }
        boolean replaced = node.adoptChain(best);
        if (replaced) {
            String source = bestPeer;
            long length = maxLength;
            LOG.info(() -> "Adopted chain of " + length + " blocks from " + source);
        }
        return replaced;
    }
}
