package io.landledger.core.storage;

import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The node's chain: an ordered, append-only list of blocks backed by a
 * {@link ChainStore}.
 *
 * The in-memory list is authoritative. Writes go to memory first and to the
 * store second, so a {@link PersistenceException} leaves memory updated.
 * Only {@link #replace(List)} may discard blocks, and only as a whole chain.
 */
public final class Ledger {
    private static final Logger LOG = Logger.getLogger(Ledger.class.getName());

    private final ChainStore store;
    private final List<Block> blocks = new ArrayList<>();

    public Ledger(ChainStore store) {
        this.store = store;
    }

    /**
     * Load persisted blocks. An empty store, or one holding records that
     * cannot be decoded, starts over from a fresh genesis. Stored blocks that
     * do not link up are cut off at the first break and the store is rewritten.
     */
    public synchronized void loadFromDurable() {
        List<Block> loaded;
        try {
            loaded = store.loadBlocks();
        } catch (IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Stored chain is unreadable; starting from a new genesis", e);
            loaded = List.of();
        }
        blocks.clear();
        if (loaded.isEmpty()) {
            blocks.add(GenesisBuilder.buildGenesis());
            store.replaceBlocks(blocks);
            LOG.info("Created genesis block");
            return;
        }
        int linked = linkedPrefixLength(loaded);
        if (linked == 0) {
            LOG.warning("Stored chain has no usable genesis; starting from a new genesis");
            blocks.add(GenesisBuilder.buildGenesis());
            store.replaceBlocks(blocks);
            return;
        }
        blocks.addAll(loaded.subList(0, linked));
        if (linked < loaded.size()) {
            LOG.warning("Stored chain breaks after block " + blocks.get(linked - 1).index()
                    + "; dropping " + (loaded.size() - linked) + " stored blocks");
            store.replaceBlocks(List.copyOf(blocks));
        }
        LOG.info(() -> "Loaded " + blocks.size() + " blocks from storage");
    }

    public synchronized Block genesis() {
        requireLoaded();
        return blocks.get(0);
    }

    public synchronized Block head() {
        requireLoaded();
        return blocks.get(blocks.size() - 1);
    }

    /**
     * Append a block on top of the current head.
     *
     * @throws ChainLinkageException if the block's index or previous_hash does
     *         not extend the head; nothing is changed
     * @throws PersistenceException if the durable write failed; the block is
     *         already part of the in-memory chain and is written with the
     *         next successful append
     */
    public synchronized void append(Block block) {
        Block head = head();
        long expectedIndex = head.index() + 1;
        if (block.index() != expectedIndex) {
            throw new ChainLinkageException("Block index " + block.index() + " does not follow head " + head.index(),
                    expectedIndex, block.index());
        }
        if (!head.hash().equals(block.previousHash())) {
            throw new ChainLinkageException("Block " + block.index() + " does not link to head " + head.hash(),
                    expectedIndex, block.index());
        }
        boolean storeBehind = store.size() != blocks.size();
        blocks.add(block);
        if (storeBehind) {
            LOG.info(() -> "Store is behind the in-memory chain; rewriting " + blocks.size() + " blocks");
            store.replaceBlocks(List.copyOf(blocks));
        } else {
            store.appendBlock(block);
        }
    }

    /** Swap in a whole chain (consensus only) and persist it. */
    public synchronized void replace(List<Block> chain) {
        if (chain == null || chain.isEmpty()) {
            throw new IllegalArgumentException("Replacement chain must not be empty");
        }
        blocks.clear();
        blocks.addAll(chain);
        store.replaceBlocks(List.copyOf(blocks));
    }

    public synchronized List<Block> blocks() {
        return List.copyOf(blocks);
    }

    public synchronized int length() {
        return blocks.size();
    }

    public synchronized Set<String> transactionIds() {
        Set<String> ids = new HashSet<>();
        for (Block block : blocks) {
            for (Transaction tx : block.transactions()) {
                if (tx.hasTxid()) ids.add(tx.txid());
            }
        }
        return ids;
    }

    public synchronized boolean containsTransaction(String txid) {
        if (txid == null) return false;
        for (Block block : blocks) {
            for (Transaction tx : block.transactions()) {
                if (txid.equals(tx.txid())) return true;
            }
        }
        return false;
    }

    /** Number of leading blocks with consecutive indexes, intact hashes and matching links. */
    private static int linkedPrefixLength(List<Block> chain) {
        Block genesis = chain.get(0);
        if (genesis.index() != 1L || !Block.GENESIS_PREVIOUS_HASH.equals(genesis.previousHash())
                || !genesis.hashMatchesContent()) {
            return 0;
        }
        for (int i = 1; i < chain.size(); i++) {
            Block prev = chain.get(i - 1);
            Block curr = chain.get(i);
            if (curr.index() != prev.index() + 1 || !prev.hash().equals(curr.previousHash())
                    || !curr.hashMatchesContent()) {
                return i;
            }
        }
        return chain.size();
    }

    private void requireLoaded() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("Ledger not loaded; call loadFromDurable() first");
        }
    }
}
