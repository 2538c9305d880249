package io.landledger.core.node;

/** Simple config holder for a local node. */
public final class NodeConfig {
    public final int difficulty;
    public final long syncIntervalMillis;
    public final long peerTimeoutMillis;

    public NodeConfig(int difficulty, long syncIntervalMillis, long peerTimeoutMillis) {
        if (syncIntervalMillis <= 0) {
            throw new IllegalArgumentException("syncIntervalMillis must be > 0");
        }
        if (peerTimeoutMillis <= 0) {
            throw new IllegalArgumentException("peerTimeoutMillis must be > 0");
        }
        this.difficulty = difficulty;
        this.syncIntervalMillis = syncIntervalMillis;
        this.peerTimeoutMillis = peerTimeoutMillis;
    }

    public static NodeConfig defaultLocal() {
        return new NodeConfig(
                3,          // leading zero hex chars; ~4k digests per block
                5_000L,     // sync cycle interval
                3_000L      // per-peer request timeout
        );
    }

    public NodeConfig withDifficulty(int difficulty) {
        return new NodeConfig(difficulty, this.syncIntervalMillis, this.peerTimeoutMillis);
    }

    public NodeConfig withSyncIntervalMillis(long syncIntervalMillis) {
        return new NodeConfig(this.difficulty, syncIntervalMillis, this.peerTimeoutMillis);
    }

    public NodeConfig withPeerTimeoutMillis(long peerTimeoutMillis) {
        return new NodeConfig(this.difficulty, this.syncIntervalMillis, peerTimeoutMillis);
    }
}
