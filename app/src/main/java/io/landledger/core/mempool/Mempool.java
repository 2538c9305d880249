package io.landledger.core.mempool;

import io.landledger.core.protocol.Transaction;
import io.landledger.core.storage.ChainStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pending transactions keyed by txid:
 * - iteration follows insertion order, which is the order blocks include them;
 * - entries leave only through {@link #commit(Collection)}, once a block holding
 *   them has been appended, never when a block is merely assembled;
 * - every change is written through to the {@link ChainStore}.
 */
public final class Mempool {
    private static final Logger LOG = Logger.getLogger(Mempool.class.getName());

    private final Map<String, Transaction> pending = new LinkedHashMap<>();
    private final TxValidator validator;
    private final ChainStore store;

    public Mempool(TxValidator validator, ChainStore store) {
        this.validator = validator;
        this.store = store;
    }

    /** Replace the in-memory pool with what the store holds; an unreadable store yields an empty pool. */
    public synchronized void load() {
        pending.clear();
        List<Transaction> stored;
        try {
            stored = store.loadMempool();
        } catch (IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Stored mempool is unreadable; starting empty", e);
            stored = List.of();
        }
        for (Transaction tx : stored) {
            if (tx.hasTxid()) {
                pending.putIfAbsent(tx.txid(), tx);
            }
        }
        if (!pending.isEmpty()) {
            LOG.info(() -> "Loaded " + pending.size() + " pending transactions from storage");
        }
    }

    /**
     * Validate and add a new record, assigning a txid when it has none.
     *
     * @return the stored transaction, carrying its txid
     */
    public synchronized Transaction add(Transaction tx) {
        validator.validate(tx);
        Transaction stored = tx.hasTxid() ? tx : tx.withTxid(Transaction.newTxid());
        if (pending.containsKey(stored.txid())) {
            throw new IllegalArgumentException("Duplicate txid " + stored.txid());
        }
        pending.put(stored.txid(), stored);
        persist();
        return stored;
    }

    /** Current pending transactions; nothing is removed. */
    public synchronized List<Transaction> snapshot() {
        return List.copyOf(pending.values());
    }

    /**
     * Remove exactly the given txids, after the block holding them was appended.
     *
     * @return how many were actually present
     */
    public synchronized int commit(Collection<String> includedTxids) {
        int removed = 0;
        for (String txid : includedTxids) {
            if (txid != null && pending.remove(txid) != null) {
                removed++;
            }
        }
        if (removed > 0) {
            persist();
        }
        return removed;
    }

    /**
     * Union with a peer's pool. A txid already held locally keeps the local
     * record; entries without a txid are ignored.
     *
     * @return how many transactions were added
     */
    public synchronized int merge(Collection<Transaction> remote) {
        int added = 0;
        for (Transaction tx : remote) {
            if (tx == null || !tx.hasTxid()) {
                continue;
            }
            if (pending.putIfAbsent(tx.txid(), tx) == null) {
                added++;
            }
        }
        if (added > 0) {
            persist();
        }
        return added;
    }

    public synchronized boolean contains(String txid) {
        return pending.containsKey(txid);
    }

    public synchronized Transaction get(String txid) {
        return pending.get(txid);
    }

    public synchronized boolean isEmpty() { return pending.isEmpty(); }

    public synchronized int size() { return pending.size(); }

    private void persist() {
        store.saveMempool(new ArrayList<>(pending.values()));
    }
}
