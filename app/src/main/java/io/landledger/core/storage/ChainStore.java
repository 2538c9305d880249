package io.landledger.core.storage;

import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;

import java.util.List;

/**
 * Durable home of one node's chain and mempool.
 *
 * Notes:
 * - Blocks are kept as an ordered sequence of records, addressed by index.
 * - The mempool is kept as an ordered sequence of transaction records and is
 *   rewritten as a whole on every change.
 * - Implementations throw {@link PersistenceException} when the medium fails.
 */
public interface ChainStore {

    /** All stored blocks in chain order; empty when nothing was persisted yet. */
    List<Block> loadBlocks();

    /** Persist one more block after the current last one. */
    void appendBlock(Block block);

    /** Drop every stored block and write the given chain instead. */
    void replaceBlocks(List<Block> blocks);

    /** Pending transactions in insertion order. */
    List<Transaction> loadMempool();

    /** Overwrite the stored mempool. */
    void saveMempool(List<Transaction> transactions);

    /** Number of blocks stored (debug/metrics). */
    long size();
}
