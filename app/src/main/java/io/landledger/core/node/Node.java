package io.landledger.core.node;

import io.landledger.core.consensus.ChainValidator;
import io.landledger.core.consensus.ProofOfWork;
import io.landledger.core.consensus.ValidationResult;
import io.landledger.core.mempool.Mempool;
import io.landledger.core.mempool.TxValidator;
import io.landledger.core.metrics.SyncMetrics;
import io.landledger.core.p2p.PeerRegistry;
import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;
import io.landledger.core.storage.ChainStore;
import io.landledger.core.storage.InMemoryChainStore;
import io.landledger.core.storage.Ledger;
import io.landledger.core.storage.RocksDBChainStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires storage, ledger, mempool, peers and the block producer, and owns the
 * lock that every multi-step change of chain and mempool runs under.
 *
 * The API handlers and the sync loop share one Node; nothing else mutates
 * ledger or mempool. Peer I/O never happens while the lock is held.
 */
public final class Node implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(Node.class.getName());

    private final NodeConfig config;
    private final ChainStore store;
    private final Ledger ledger;
    private final Mempool mempool;
    private final PeerRegistry peers;
    private final ProofOfWork pow;
    private final ChainValidator validator;
    private final BlockProducer producer;
    private final ReentrantLock stateLock = new ReentrantLock();

    public Node(ChainStore store, NodeConfig config) {
        this.config = config;
        this.store = store;
        this.ledger = new Ledger(store);
        this.mempool = new Mempool(new TxValidator(), store);
        this.peers = new PeerRegistry();
        this.pow = new ProofOfWork(config.difficulty);
        this.validator = new ChainValidator(pow);
        this.producer = new BlockProducer(ledger, mempool, pow, stateLock);
    }

    /** Convenience factory for an in-memory local node. */
    public static Node inMemory(NodeConfig config) {
        return new Node(new InMemoryChainStore(), config);
    }

    /** Convenience factory for a RocksDB-backed node. */
    public static Node rocks(NodeConfig config, Path dataDir) {
        return new Node(RocksDBChainStore.open(dataDir), config);
    }

    /** Load chain and mempool from storage (genesis on first run). Safe to call multiple times. */
    public void start() {
        stateLock.lock();
        try {
            ledger.loadFromDurable();
            mempool.load();
            int stale = mempool.commit(ledger.transactionIds());
            if (stale > 0) {
                LOG.info("Dropped " + stale + " stored pending transactions already in the chain");
            }
        } finally {
            stateLock.unlock();
        }
    }

    /** Validate and queue a record for the next block. */
    public Transaction submitTransaction(Transaction tx) {
        stateLock.lock();
        try {
            Transaction stored = mempool.add(tx);
            LOG.fine(() -> "Accepted transaction " + stored.txid());
            return stored;
        } finally {
            stateLock.unlock();
        }
    }

    /** Mine one block from the mempool; empty when there is nothing to mine. */
    public Optional<Block> mine() {
        return producer.tick();
    }

    /**
     * Replace the local chain with an already validated candidate if it is
     * still strictly longer than ours, then evict every pending transaction the
     * candidate contains.
     *
     * @return true when the chain was replaced
     */
    public boolean adoptChain(List<Block> candidate) {
        stateLock.lock();
        try {
            int localLength = ledger.length();
            if (candidate.size() <= localLength) {
                LOG.fine(() -> "Candidate chain of " + candidate.size() + " no longer beats local " + localLength);
                return false;
            }
            List<String> adoptedTxids = new ArrayList<>();
            for (Block block : candidate) {
                for (Transaction tx : block.transactions()) {
                    adoptedTxids.add(tx.txid());
                }
            }
            try {
                ledger.replace(candidate);
            } finally {
                mempool.commit(adoptedTxids);
            }
            SyncMetrics.recordChainReplaced();
            LOG.info(() -> "Replaced local chain (" + localLength + " blocks) with peer chain of " + candidate.size());
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Merge a peer's pending transactions, skipping any already committed to
     * our chain.
     *
     * @return how many were added
     */
    public int mergeRemoteTransactions(Collection<Transaction> remote) {
        stateLock.lock();
        try {
            Set<String> committed = ledger.transactionIds();
            List<Transaction> fresh = new ArrayList<>(remote.size());
            for (Transaction tx : remote) {
                if (tx != null && tx.hasTxid() && !committed.contains(tx.txid())) {
                    fresh.add(tx);
                }
            }
            return mempool.merge(fresh);
        } finally {
            stateLock.unlock();
        }
    }

    public String registerPeer(String address) {
        return peers.register(address);
    }

    public List<Block> chain() {
        return ledger.blocks();
    }

    public int chainLength() {
        return ledger.length();
    }

    public List<Transaction> pendingTransactions() {
        return mempool.snapshot();
    }

    /** Every integrity problem in the local chain; empty when it is sound. */
    public List<ValidationResult> auditChain() {
        return validator.audit(ledger.blocks());
    }

    /** Close underlying resources if any (e.g., RocksDB). */
    @Override
    public void close() {
        if (store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.log(Level.WARNING, "Failed to close chain store", e);
            }
        }
    }

    // Properly typed accessors
    public NodeConfig config() { return config; }
    public Ledger ledger() { return ledger; }
    public Mempool mempool() { return mempool; }
    public PeerRegistry peers() { return peers; }
    public ProofOfWork pow() { return pow; }
    public ChainValidator validator() { return validator; }
    public BlockProducer producer() { return producer; }
}
