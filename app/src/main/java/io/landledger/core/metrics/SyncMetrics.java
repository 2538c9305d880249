package io.landledger.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/** Counters for the background sync loop and the peer calls it makes. */
public final class SyncMetrics {
    private static final Counter cycles;
    private static final Counter failures;
    private static final Counter chainReplacements;
    private static final Counter peerFetchFailures;
    private static final Counter rejectedChains;
    private static final Counter mergedTransactions;

    static {
        MeterRegistry registry = BlockMetrics.registry();
        cycles = Counter.builder("sync.cycles")
                .description("Completed background sync cycles")
                .register(registry);
        failures = Counter.builder("sync.failures")
                .description("Sync phases that ended with an error")
                .register(registry);
        chainReplacements = Counter.builder("chain.replacements")
                .description("Times the local chain was replaced by a longer peer chain")
                .register(registry);
        peerFetchFailures = Counter.builder("peer.fetch.failures")
                .description("Peer chain or mempool fetches that failed or timed out")
                .register(registry);
        rejectedChains = Counter.builder("peer.chains.rejected")
                .description("Peer chains discarded by validation")
                .register(registry);
        mergedTransactions = Counter.builder("mempool.merged")
                .description("Transactions added from peer mempools")
                .register(registry);
    }

    private SyncMetrics() {}

    public static void recordCycle() { cycles.increment(); }

    public static void recordFailure() { failures.increment(); }

    public static void recordChainReplaced() { chainReplacements.increment(); }

    public static void recordPeerFetchFailure() { peerFetchFailures.increment(); }

    public static void recordRejectedChain() { rejectedChains.increment(); }

    public static void recordMerged(int count) { mergedTransactions.increment(count); }

    public static double failureCount() { return failures.count(); }

    public static double cycleCount() { return cycles.count(); }
}
