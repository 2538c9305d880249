package io.landledger.core.mempool;

import io.landledger.core.ChainFixtures;
import io.landledger.core.FakePeerClient;
import io.landledger.core.node.Node;
import io.landledger.core.node.NodeConfig;
import io.landledger.core.protocol.Transaction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MempoolSynchronizerTest {

    private Node node;

    @BeforeEach
    void setUp() {
        node = Node.inMemory(NodeConfig.defaultLocal().withDifficulty(ChainFixtures.DIFFICULTY));
        node.start();
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    @Test
    void unionKeepsLocalRecordForSharedTxid() {
        node.submitTransaction(ChainFixtures.tx("a", "100"));
        node.registerPeer("peer-a:5001");
        FakePeerClient client = new FakePeerClient()
                .withMempool("peer-a:5001", List.of(ChainFixtures.tx("a", "999"), ChainFixtures.tx("b", "40")));

        int added = new MempoolSynchronizer(node, client).synchronize();

        assertEquals(1, added);
        List<Transaction> pending = node.pendingTransactions();
        assertEquals(List.of("a", "b"), pending.stream().map(Transaction::txid).toList());
        assertEquals("100", node.mempool().get("a").luas());
    }

    @Test
    void transactionsAlreadyInChainAreNotReadded() {
        node.submitTransaction(ChainFixtures.tx("mined", "10"));
        assertTrue(node.mine().isPresent());
        node.registerPeer("peer-a:5001");
        FakePeerClient client = new FakePeerClient()
                .withMempool("peer-a:5001", List.of(ChainFixtures.tx("mined", "10")));

        assertEquals(0, new MempoolSynchronizer(node, client).synchronize());
        assertTrue(node.mempool().isEmpty());
    }

    @Test
    void unreachablePeerIsSkipped() {
        node.registerPeer("down:5001");
        node.registerPeer("up:5002");
        FakePeerClient client = new FakePeerClient()
                .withMempool("up:5002", List.of(ChainFixtures.tx("x", "1")));

        assertEquals(1, new MempoolSynchronizer(node, client).synchronize());
        assertTrue(node.mempool().contains("x"));
    }

    @Test
    void mergedTransactionsCanBeMined() {
        node.registerPeer("peer-a:5001");
        FakePeerClient client = new FakePeerClient()
                .withMempool("peer-a:5001", List.of(ChainFixtures.tx("remote", "77")));
        new MempoolSynchronizer(node, client).synchronize();

        var block = node.mine().orElseThrow();

        assertEquals("remote", block.transactions().get(0).txid());
        assertTrue(node.mempool().isEmpty());
    }
}
