package io.landledger.core.storage;

import io.landledger.core.ChainFixtures;
import io.landledger.core.consensus.ChainValidator;
import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerTest {

    @Test
    void emptyStoreStartsWithGenesis() {
        InMemoryChainStore store = new InMemoryChainStore();
        Ledger ledger = new Ledger(store);
        ledger.loadFromDurable();

        Block genesis = ledger.genesis();
        assertEquals(1, ledger.length());
        assertEquals(1L, genesis.index());
        assertEquals(Block.GENESIS_PREVIOUS_HASH, genesis.previousHash());
        assertEquals(0L, genesis.proof());
        assertTrue(genesis.transactions().isEmpty());
        assertEquals(1, store.size());
    }

    @Test
    void appendThenReloadKeepsChain() {
        InMemoryChainStore store = new InMemoryChainStore();
        Ledger ledger = new Ledger(store);
        ledger.loadFromDurable();
        Block next = ChainFixtures.next(ledger.head(), List.of(ChainFixtures.tx("t1", "10")));
        ledger.append(next);

        Ledger reloaded = new Ledger(store);
        reloaded.loadFromDurable();

        assertEquals(2, reloaded.length());
        assertEquals(next.hash(), reloaded.head().hash());
        assertTrue(reloaded.containsTransaction("t1"));
        assertEquals(java.util.Set.of("t1"), reloaded.transactionIds());
    }

    @Test
    void appendRejectsBlockNotOnHead() {
        Ledger ledger = new Ledger(new InMemoryChainStore());
        ledger.loadFromDurable();
        Block head = ledger.head();

        Block wrongIndex = new Block(5, 1L, List.of(), 0, head.hash());
        ChainLinkageException e = assertThrows(ChainLinkageException.class, () -> ledger.append(wrongIndex));
        assertEquals(2L, e.expectedIndex());
        assertEquals(5L, e.actualIndex());

        Block wrongParent = new Block(2, 1L, List.of(), 0, "f00d");
        assertThrows(ChainLinkageException.class, () -> ledger.append(wrongParent));
        assertEquals(1, ledger.length());
    }

    @Test
    void replaceSwapsWholeChainAndPersists() {
        InMemoryChainStore store = new InMemoryChainStore();
        Ledger ledger = new Ledger(store);
        ledger.loadFromDurable();
        List<Block> chain = ChainFixtures.chain(3);

        ledger.replace(chain);

        assertEquals(chain, ledger.blocks());
        assertEquals(chain, store.loadBlocks());
        assertThrows(IllegalArgumentException.class, () -> ledger.replace(List.of()));
    }

    @Test
    void persistenceFailureLeavesMemoryAuthoritative() {
        FlakyStore store = new FlakyStore();
        Ledger ledger = new Ledger(store);
        ledger.loadFromDurable();
        Block next = ChainFixtures.next(ledger.head(), List.of());

        store.failWrites = true;
        assertThrows(PersistenceException.class, () -> ledger.append(next));
        assertEquals(2, ledger.length());
        assertEquals(1, store.loadBlocks().size());
    }

    @Test
    void appendAfterFailedWriteCatchesStoreUp() {
        FlakyStore store = new FlakyStore();
        Ledger ledger = new Ledger(store);
        ledger.loadFromDurable();

        store.failWrites = true;
        Block lost = ChainFixtures.next(ledger.head(), List.of(ChainFixtures.tx("lost", "1")));
        assertThrows(PersistenceException.class, () -> ledger.append(lost));
        store.failWrites = false;
        ledger.append(ChainFixtures.next(ledger.head(), List.of(ChainFixtures.tx("kept", "2"))));

        Ledger reloaded = new Ledger(store);
        reloaded.loadFromDurable();

        assertEquals(3, reloaded.length());
        assertEquals(List.of(1L, 2L, 3L), reloaded.blocks().stream().map(Block::index).toList());
        assertTrue(reloaded.containsTransaction("lost"));
        assertTrue(new ChainValidator(ChainFixtures.POW).audit(reloaded.blocks()).isEmpty());
    }

    @Test
    void storedChainWithGapIsCutAtTheBreak() {
        InMemoryChainStore store = new InMemoryChainStore();
        List<Block> chain = ChainFixtures.chain(4);
        store.replaceBlocks(List.of(chain.get(0), chain.get(1), chain.get(3)));

        Ledger ledger = new Ledger(store);
        ledger.loadFromDurable();

        assertEquals(2, ledger.length());
        assertEquals(chain.get(1).hash(), ledger.head().hash());
        assertEquals(2, store.loadBlocks().size());
    }

    @Test
    void unreadableStoreStartsOverFromGenesis() {
        InMemoryChainStore delegate = new InMemoryChainStore();
        Ledger ledger = new Ledger(new FlakyStore(delegate) {
            @Override
            public List<Block> loadBlocks() {
                throw new IllegalArgumentException("Malformed Block bytes");
            }
        });

        ledger.loadFromDurable();

        assertEquals(1, ledger.length());
        assertEquals(1, delegate.loadBlocks().size());
    }

    @Test
    void readsBeforeLoadFail() {
        Ledger ledger = new Ledger(new InMemoryChainStore());
        assertThrows(IllegalStateException.class, ledger::head);
    }

    /** Wraps an in-memory store and fails writes on demand. */
    static class FlakyStore implements ChainStore {
        private final InMemoryChainStore delegate;
        volatile boolean failWrites;

        FlakyStore() {
            this(new InMemoryChainStore());
        }

        FlakyStore(InMemoryChainStore delegate) {
            this.delegate = delegate;
        }

        @Override public List<Block> loadBlocks() { return delegate.loadBlocks(); }

        @Override
        public void appendBlock(Block block) {
            failIfAsked();
            delegate.appendBlock(block);
        }

        @Override
        public void replaceBlocks(List<Block> blocks) {
            failIfAsked();
            delegate.replaceBlocks(blocks);
        }

        @Override public List<Transaction> loadMempool() { return delegate.loadMempool(); }

        @Override
        public void saveMempool(List<Transaction> transactions) {
            failIfAsked();
            delegate.saveMempool(transactions);
        }

        @Override public long size() { return delegate.size(); }

        private void failIfAsked() {
            if (failWrites) {
                throw new PersistenceException("disk full", new java.io.IOException("ENOSPC"));
            }
        }
    }
}
