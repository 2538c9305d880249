package io.landledger.core;

import io.landledger.core.api.ApiServer;
import io.landledger.core.consensus.ConsensusResolver;
import io.landledger.core.mempool.MempoolSynchronizer;
import io.landledger.core.node.Node;
import io.landledger.core.node.NodeConfig;
import io.landledger.core.node.SyncScheduler;
import io.landledger.core.p2p.HttpPeerClient;
import io.landledger.core.p2p.InvalidAddressException;
import io.landledger.core.p2p.PeerClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        NodeConfig config = NodeConfig.defaultLocal()
                .withDifficulty(options.difficulty())
                .withSyncIntervalMillis(options.syncIntervalMillis())
                .withPeerTimeoutMillis(options.peerTimeoutMillis());

        Node node;
        if (options.inMemory()) {
            node = Node.inMemory(config);
            LOG.info("Using in-memory storage; nothing survives a restart");
        } else {
            Path nodeDir = options.nodeDataDir();
            node = Node.rocks(config, nodeDir);
            LOG.info("Using RocksDB storage at " + nodeDir);
        }

        ApiServer apiServer = null;
        SyncScheduler scheduler = null;
        try {
            node.start();
            LOG.info("Chain length " + node.chainLength() + ", difficulty " + config.difficulty
                    + ", " + node.pendingTransactions().size() + " pending transactions");

            for (String peer : options.peers()) {
                try {
                    node.registerPeer(peer);
                } catch (InvalidAddressException e) {
                    LOG.warning("Ignoring bootstrap peer: " + e.getMessage());
                }
            }

            PeerClient peerClient = new HttpPeerClient(Duration.ofMillis(config.peerTimeoutMillis));
            ConsensusResolver resolver = new ConsensusResolver(node, peerClient);
            MempoolSynchronizer synchronizer = new MempoolSynchronizer(node, peerClient);

            apiServer = new ApiServer(node, resolver, options.bind(), options.port());
            apiServer.start();

            if (options.sync()) {
                scheduler = new SyncScheduler(resolver, synchronizer, config.syncIntervalMillis);
                scheduler.start();
            } else {
                LOG.info("Background sync disabled (--no-sync)");
            }

            CountDownLatch shutdownLatch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "land-ledger-shutdown"));
            LOG.info("Node running. Press CTRL+C to exit.");
            shutdownLatch.await();
        } finally {
            if (scheduler != null) {
                scheduler.stop();
            }
            if (apiServer != null) {
                apiServer.stop();
            }
            node.close();
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to load logging.properties; using JDK defaults", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            int port,
            String bind,
            int difficulty,
            Path dataDir,
            List<String> peers,
            long syncIntervalMillis,
            long peerTimeoutMillis,
            boolean inMemory,
            boolean sync
    ) {
        static final int DEFAULT_PORT = 5000;

        static CliOptions parse(String[] args) {
            NodeConfig defaults = NodeConfig.defaultLocal();
            boolean showHelp = false;
            String error = null;

            int port = DEFAULT_PORT;
            String bind = envOrDefault("LAND_LEDGER_BIND", "0.0.0.0");
            int difficulty = defaults.difficulty;
            Path dataDir = Path.of(envOrDefault("LAND_LEDGER_DATA_DIR", "./data"));
            long syncIntervalMillis = defaults.syncIntervalMillis;
            long peerTimeoutMillis = defaults.peerTimeoutMillis;
            boolean inMemory = false;
            boolean sync = true;

            List<String> peers = new ArrayList<>();
            String peersEnv = System.getenv("LAND_LEDGER_PEERS");
            if (peersEnv != null && !peersEnv.isBlank()) {
                for (String endpoint : peersEnv.split(",")) {
                    if (!endpoint.isBlank()) {
                        peers.add(endpoint.trim());
                    }
                }
            }

            try {
                port = envPort("LAND_LEDGER_PORT", DEFAULT_PORT);
                String difficultyEnv = System.getenv("LAND_LEDGER_DIFFICULTY");
                if (difficultyEnv != null && !difficultyEnv.isBlank()) {
                    difficulty = parseDifficulty(difficultyEnv, "LAND_LEDGER_DIFFICULTY");
                }
                String intervalEnv = System.getenv("LAND_LEDGER_SYNC_INTERVAL_MS");
                if (intervalEnv != null && !intervalEnv.isBlank()) {
                    syncIntervalMillis = parsePositiveLong(intervalEnv, "LAND_LEDGER_SYNC_INTERVAL_MS");
                }
            } catch (IllegalArgumentException ex) {
                showHelp = true;
                error = ex.getMessage();
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    try {
                        if ("--help".equals(arg) || "-h".equals(arg)) {
                            showHelp = true;
                        } else if (arg.startsWith("--port=")) {
                            port = parsePort(arg.substring("--port=".length()), "--port");
                        } else if (arg.startsWith("--bind=")) {
                            bind = arg.substring("--bind=".length());
                        } else if (arg.startsWith("--difficulty=")) {
                            difficulty = parseDifficulty(arg.substring("--difficulty=".length()), "--difficulty");
                        } else if (arg.startsWith("--data-dir=")) {
                            dataDir = Path.of(arg.substring("--data-dir=".length()));
                        } else if (arg.startsWith("--peer=")) {
                            peers.add(arg.substring("--peer=".length()));
                        } else if (arg.startsWith("--sync-interval-ms=")) {
                            syncIntervalMillis = parsePositiveLong(arg.substring("--sync-interval-ms=".length()), "--sync-interval-ms");
                        } else if (arg.startsWith("--peer-timeout-ms=")) {
                            peerTimeoutMillis = parsePositiveLong(arg.substring("--peer-timeout-ms=".length()), "--peer-timeout-ms");
                        } else if (arg.equals("--in-memory")) {
                            inMemory = true;
                        } else if (arg.equals("--no-sync")) {
                            sync = false;
                        } else if (!arg.startsWith("--")) {
                            port = parsePort(arg, "port");
                        } else if (error == null) {
                            showHelp = true;
                            error = "Unknown option: " + arg;
                        }
                    } catch (IllegalArgumentException ex) {
                        showHelp = true;
                        if (error == null) {
                            error = ex.getMessage();
                        }
                    }
                }
            }

            return new CliOptions(
                    showHelp,
                    error,
                    port,
                    bind,
                    difficulty,
                    dataDir,
                    List.copyOf(peers),
                    syncIntervalMillis,
                    peerTimeoutMillis,
                    inMemory,
                    sync
            );
        }

        /** Each port gets its own store so several nodes can share one data dir. */
        Path nodeDataDir() {
            return dataDir.resolve("node-" + port).toAbsolutePath().normalize();
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: land-ledger [port] [options]

Options:
  --help, -h                 Show this help message and exit
  --port=<port>              HTTP port (default 5000; a bare number works too)
  --bind=<host>              Bind address for the HTTP API (default 0.0.0.0)
  --difficulty=<n>           Leading zero hex characters required by proof of work (default 3)
  --data-dir=<path>          Base directory for RocksDB data, one node-<port> dir per node (default ./data)
  --peer=<host:port>         Register a peer at startup (repeatable)
  --sync-interval-ms=<ms>    Background sync interval (default 5000)
  --peer-timeout-ms=<ms>     Timeout for each peer request (default 3000)
  --in-memory                Keep chain and mempool in memory only
  --no-sync                  Do not start the background sync loop

Environment overrides:
  LAND_LEDGER_PORT           Default port
  LAND_LEDGER_BIND           Default bind address
  LAND_LEDGER_DIFFICULTY     Default difficulty
  LAND_LEDGER_DATA_DIR       Default data directory
  LAND_LEDGER_PEERS          Comma-separated peers registered at startup
  LAND_LEDGER_SYNC_INTERVAL_MS Default sync interval
""");
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static int envPort(String key, int fallback) {
            String value = System.getenv(key);
            if (value == null || value.isBlank()) {
                return fallback;
            }
            return parsePort(value, key);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port <= 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parseDifficulty(String value, String flag) {
            try {
                int difficulty = Integer.parseInt(value);
                if (difficulty < 0 || difficulty > 64) {
                    throw new NumberFormatException();
                }
                return difficulty;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid difficulty for " + flag + ": " + value);
            }
        }

        private static long parsePositiveLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
