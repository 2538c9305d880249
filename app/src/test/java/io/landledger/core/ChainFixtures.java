package io.landledger.core;

import io.landledger.core.consensus.ProofOfWork;
import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;
import io.landledger.core.storage.GenesisBuilder;

import java.util.ArrayList;
import java.util.List;

/** Builds properly mined chains for tests. Difficulty 2 keeps each block to a few hundred digests. */
public final class ChainFixtures {
    public static final int DIFFICULTY = 2;
    public static final ProofOfWork POW = new ProofOfWork(DIFFICULTY);

    private ChainFixtures() {}

    public static Transaction tx(String txid, String luas) {
        return Transaction.builder()
                .txid(txid)
                .nama("Budi Santoso")
                .nomorSertifikat("SHM-" + txid)
                .lokasi("Sleman, Yogyakarta")
                .luas(luas)
                .timestamp(1_700_000_000_000L)
                .build();
    }

    /** Genesis plus {@code length - 1} mined blocks, one fresh transaction each. */
    public static List<Block> chain(int length) {
        List<List<Transaction>> payloads = new ArrayList<>();
        for (int i = 1; i < length; i++) {
            payloads.add(List.of(tx(Transaction.newTxid(), Integer.toString(100 * i))));
        }
        return chainWith(payloads);
    }

    /** Genesis plus one mined block per payload entry. */
    public static List<Block> chainWith(List<List<Transaction>> payloads) {
        List<Block> chain = new ArrayList<>();
        chain.add(GenesisBuilder.buildGenesis(1_700_000_000_000L));
        for (List<Transaction> txs : payloads) {
            chain.add(next(chain.get(chain.size() - 1), txs));
        }
        return chain;
    }

    public static Block next(Block prev, List<Transaction> txs) {
        long proof = POW.proofOfWork(prev.proof());
        return new Block(prev.index() + 1, prev.timestamp() + 1_000L, txs, proof, prev.hash());
    }
}
