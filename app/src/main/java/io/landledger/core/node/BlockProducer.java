package io.landledger.core.node;

import io.landledger.core.consensus.ProofOfWork;
import io.landledger.core.mempool.Mempool;
import io.landledger.core.metrics.BlockMetrics;
import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;
import io.landledger.core.storage.ChainLinkageException;
import io.landledger.core.storage.Ledger;
import io.landledger.core.storage.PersistenceException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.logging.Logger;

/**
 * Mines one block from the pending transactions in three steps:
 * <ol>
 *   <li>{@link #prepare()}: under the state lock, read the head and snapshot the mempool;</li>
 *   <li>{@link #solve(MiningJob)}: search the proof with no lock held;</li>
 *   <li>{@link #commit(Block)}: under the lock again, append and drop the included transactions.</li>
 * </ol>
 * If the head moved while solving (a peer chain was adopted, another block was
 * mined) the append fails with {@link ChainLinkageException} and nothing changes.
 */
public final class BlockProducer {
    private static final Logger LOG = Logger.getLogger(BlockProducer.class.getName());

    /** Everything the proof search needs, captured from the head at prepare time. */
    public record MiningJob(long index, String previousHash, long lastProof, List<Transaction> transactions) {
        public MiningJob {
            transactions = List.copyOf(transactions);
        }
    }

    private final Ledger ledger;
    private final Mempool mempool;
    private final ProofOfWork pow;
    private final Lock stateLock;

    public BlockProducer(Ledger ledger, Mempool mempool, ProofOfWork pow, Lock stateLock) {
        this.ledger = ledger;
        this.mempool = mempool;
        this.pow = pow;
        this.stateLock = stateLock;
    }

    /** Mine one block; empty when there is nothing pending. */
    public Optional<Block> tick() {
        Optional<MiningJob> job = prepare();
        if (job.isEmpty()) {
            LOG.fine("Mempool empty; nothing to mine");
            return Optional.empty();
        }
        return Optional.of(commit(solve(job.get())));
    }

    public Optional<MiningJob> prepare() {
        stateLock.lock();
        try {
            if (mempool.isEmpty()) {
                return Optional.empty();
            }
            Block head = ledger.head();
            return Optional.of(new MiningJob(head.index() + 1, head.hash(), head.proof(), mempool.snapshot()));
        } finally {
            stateLock.unlock();
        }
    }

    /** CPU-bound; must not be called with the state lock held. */
    public Block solve(MiningJob job) {
        long proof = BlockMetrics.recordMining(() -> pow.proofOfWork(job.lastProof()));
        return new Block(job.index(), System.currentTimeMillis(), job.transactions(), proof, job.previousHash());
    }

    /**
     * Append a solved block and evict its transactions from the mempool.
     *
     * @throws ChainLinkageException if the head changed since {@link #prepare()}
     */
    public Block commit(Block block) {
        List<String> included = txids(block);
        stateLock.lock();
        try {
            try {
                ledger.append(block);
            } catch (ChainLinkageException e) {
                BlockMetrics.incrementAppendRejected();
                LOG.info(() -> "Discarding stale block " + block.index() + ": " + e.getMessage());
                throw e;
            } catch (PersistenceException e) {
                // appended in memory; keep the pool consistent with it
                mempool.commit(included);
                throw e;
            }
            mempool.commit(included);
        } finally {
            stateLock.unlock();
        }
        BlockMetrics.incrementBlocks();
        LOG.info(() -> "Mined block " + block.index() + " with " + included.size() + " transactions (proof " + block.proof() + ")");
        return block;
    }

    private static List<String> txids(Block block) {
        List<String> ids = new ArrayList<>(block.transactions().size());
        for (Transaction tx : block.transactions()) {
            ids.add(tx.txid());
        }
        return ids;
    }
}
