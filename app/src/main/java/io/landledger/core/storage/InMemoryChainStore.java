package io.landledger.core.storage;

import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple, fast in-memory chain store.
 * Good for tests and throwaway local nodes (--in-memory).
 */
public final class InMemoryChainStore implements ChainStore {

    private final List<Block> blocks = new ArrayList<>();
    private final List<Transaction> mempool = new ArrayList<>();

    @Override
    public synchronized List<Block> loadBlocks() {
        return List.copyOf(blocks);
    }

    @Override
    public synchronized void appendBlock(Block block) {
        if (block == null) return;
        blocks.add(block);
    }

    @Override
    public synchronized void replaceBlocks(List<Block> chain) {
        blocks.clear();
        blocks.addAll(chain);
    }

    @Override
    public synchronized List<Transaction> loadMempool() {
        return List.copyOf(mempool);
    }

    @Override
    public synchronized void saveMempool(List<Transaction> transactions) {
        mempool.clear();
        mempool.addAll(transactions);
    }

    @Override
    public synchronized long size() {
        return blocks.size();
    }
}
