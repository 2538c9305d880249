package io.landledger.core.storage;

import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.Transaction;

import java.util.Collections;

/**
 * Creates the genesis block.
 * - index = 1
 * - previous_hash = "0"
 * - proof = 0, so block 2 mines against last_proof 0
 * - no transactions
 */
public final class GenesisBuilder {
    private GenesisBuilder(){}

    public static Block buildGenesis() {
        return buildGenesis(System.currentTimeMillis());
    }

    public static Block buildGenesis(long timestamp) {
        return new Block(1L, timestamp, Collections.<Transaction>emptyList(), 0L, Block.GENESIS_PREVIOUS_HASH);
    }
}
