package io.landledger.core.node;

import io.landledger.core.consensus.ConsensusResolver;
import io.landledger.core.mempool.MempoolSynchronizer;
import io.landledger.core.metrics.SyncMetrics;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background loop: every interval, resolve the chain against peers, then pull
 * their mempools.
 *
 * One daemon thread runs the cycles, so a slow cycle delays the next one
 * instead of overlapping it. A failing phase is logged and counted in
 * {@code sync.failures}; the loop keeps going.
 */
public final class SyncScheduler {
    private static final Logger LOG = Logger.getLogger(SyncScheduler.class.getName());

    private final ConsensusResolver resolver;
    private final MempoolSynchronizer synchronizer;
    private final long intervalMillis;

    private ScheduledExecutorService executor;

    public SyncScheduler(ConsensusResolver resolver, MempoolSynchronizer synchronizer, long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("intervalMillis must be > 0");
        }
        this.resolver = resolver;
        this.synchronizer = synchronizer;
        this.intervalMillis = intervalMillis;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "land-ledger-sync");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::runOnce, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOG.info("Sync loop started (every " + intervalMillis + " ms)");
    }

    public synchronized void stop() {
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    /** One full cycle on the calling thread. Never throws. */
    public void runOnce() {
        runPhase("Chain resolution", resolver::resolve);
        runPhase("Mempool synchronization", synchronizer::synchronize);
        SyncMetrics.recordCycle();
    }

    // nothing may escape: scheduleAtFixedRate cancels the task on its first throw
    private static void runPhase(String name, Runnable phase) {
        try {
            phase.run();
        } catch (Exception e) {
            SyncMetrics.recordFailure();
            LOG.log(Level.WARNING, name + " failed", e);
        } catch (Throwable t) {
            SyncMetrics.recordFailure();
            LOG.log(Level.SEVERE, name + " failed", t);
        }
    }
}
