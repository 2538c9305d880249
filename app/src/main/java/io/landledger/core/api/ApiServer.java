package io.landledger.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.landledger.core.consensus.ConsensusResolver;
import io.landledger.core.consensus.ValidationResult;
import io.landledger.core.metrics.BlockMetrics;
import io.landledger.core.metrics.HttpMetrics;
import io.landledger.core.node.Node;
import io.landledger.core.p2p.InvalidAddressException;
import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.ChainMessage;
import io.landledger.core.protocol.Hashes;
import io.landledger.core.protocol.Transaction;
import io.landledger.core.storage.ChainLinkageException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON endpoints used by operators and by peers:
 * GET /chain, GET /mempool, POST /transactions/new, GET /mine,
 * POST /nodes/register, GET /nodes, GET /nodes/resolve, GET /chain/validate,
 * GET /metrics.
 */
public class ApiServer {
    private static final Logger LOG = Logger.getLogger(ApiServer.class.getName());

    private final Node node;
    private final ConsensusResolver resolver;
    private final ObjectMapper mapper;
    private final String bindAddress;
    private final int port;
    private HttpServer httpServer;
    private ExecutorService executor;

    public ApiServer(Node node, ConsensusResolver resolver, String bindAddress, int port) {
        this.node = node;
        this.resolver = resolver;
        this.bindAddress = bindAddress;
        this.port = port;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void start() throws IOException {
        httpServer = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        httpServer.createContext("/chain", new ChainHandler());
        httpServer.createContext("/chain/validate", new ValidateChainHandler());
        httpServer.createContext("/mempool", new MempoolHandler());
        httpServer.createContext("/transactions/new", new NewTransactionHandler());
        httpServer.createContext("/mine", new MineHandler());
        httpServer.createContext("/nodes/register", new RegisterNodesHandler());
        httpServer.createContext("/nodes/resolve", new ResolveHandler());
        httpServer.createContext("/nodes", new ListNodesHandler());
        httpServer.createContext("/metrics", new MetricsHandler());
        // mining blocks a handler thread for the whole proof search
        executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "land-ledger-http");
            t.setDaemon(true);
            return t;
        });
        httpServer.setExecutor(executor);
        httpServer.start();
        LOG.info("API HTTP server started on " + bindAddress + ":" + port);
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /** Shared plumbing: exact path and verb checks, metrics, error mapping, exchange close. */
    abstract class JsonEndpoint implements HttpHandler {
        private final String allowedMethod;

        JsonEndpoint(String allowedMethod) {
            this.allowedMethod = allowedMethod;
        }

        abstract int serve(HttpExchange exchange) throws IOException;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String method = exchange.getRequestMethod();
            String path = exchange.getHttpContext().getPath();
            var sample = HttpMetrics.start();
            int status = 500;
            try {
                if (!exchange.getRequestURI().getPath().equals(path)) {
                    status = sendError(exchange, 404, "not_found", "No endpoint at " + exchange.getRequestURI().getPath());
                    return;
                }
                if (!allowedMethod.equalsIgnoreCase(method)) {
                    status = sendError(exchange, 405, "method_not_allowed", "Use " + allowedMethod + " for this endpoint");
                    return;
                }
                status = serve(exchange);
            } catch (Exception e) {
                LOG.log(Level.WARNING, method + " " + path + " failed", e);
                status = sendError(exchange, 500, "internal_error", "Unexpected server error");
            } finally {
                HttpMetrics.stop(sample, method, path, status);
                exchange.close();
            }
        }
    }

    class ChainHandler extends JsonEndpoint {
        ChainHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, ChainMessage.of(node.chain()));
        }
    }

    class ValidateChainHandler extends JsonEndpoint {
        ValidateChainHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            List<ValidationResult> issues = node.auditChain();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("valid", issues.isEmpty());
            resp.put("length", node.chainLength());
            ArrayNode array = resp.putArray("issues");
            for (ValidationResult issue : issues) {
                array.addObject()
                        .put("index", issue.blockIndex)
                        .put("error", issue.error.name())
                        .put("message", issue.message);
            }
            return sendJson(exchange, 200, resp);
        }
    }

    class MempoolHandler extends JsonEndpoint {
        MempoolHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            return sendJson(exchange, 200, node.pendingTransactions());
        }
    }

    class NewTransactionHandler extends JsonEndpoint {
        NewTransactionHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            NewTransactionRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), NewTransactionRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse transaction request");
            }
            if (req == null) {
                return sendError(exchange, 400, "invalid_json", "Request body is required");
            }
            String fileHash = req.file_hash;
            if ((fileHash == null || fileHash.isBlank()) && req.file_base64 != null && !req.file_base64.isBlank()) {
                try {
                    fileHash = Hashes.sha256Hex(Base64.getDecoder().decode(req.file_base64));
                } catch (IllegalArgumentException e) {
                    return sendError(exchange, 400, "invalid_file", "file_base64 is not valid base64");
                }
            }
            Transaction tx = Transaction.builder()
                    .nama(req.nama)
                    .nomorSertifikat(req.nomor_sertifikat)
                    .lokasi(req.lokasi)
                    .luas(req.luas)
                    .fileHash(fileHash == null || fileHash.isBlank() ? null : fileHash)
                    .build();
            try {
                Transaction stored = node.submitTransaction(tx);
                ObjectNode resp = mapper.createObjectNode()
                        .put("message", "Transaction will be added to block " + (node.ledger().head().index() + 1))
                        .put("txid", stored.txid());
                return sendJson(exchange, 201, resp);
            } catch (IllegalArgumentException e) {
                return sendError(exchange, 400, "invalid_transaction", Optional.ofNullable(e.getMessage()).orElse("Rejected transaction"));
            }
        }
    }

    class MineHandler extends JsonEndpoint {
        MineHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            Optional<Block> mined;
            try {
                mined = node.mine();
            } catch (ChainLinkageException e) {
                return sendError(exchange, 409, "chain_linkage", "Chain changed while mining; retry");
            }
            if (mined.isEmpty()) {
                return sendError(exchange, 400, "empty_mempool", "No pending transactions to mine");
            }
            Block block = mined.get();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("message", "New block forged");
            resp.put("index", block.index());
            resp.set("transactions", mapper.valueToTree(block.transactions()));
            resp.put("proof", block.proof());
            resp.put("previous_hash", block.previousHash());
            resp.put("hash", block.hash());
            return sendJson(exchange, 200, resp);
        }
    }

    class RegisterNodesHandler extends JsonEndpoint {
        RegisterNodesHandler() { super("POST"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            RegisterNodesRequest req;
            try {
                req = mapper.readValue(exchange.getRequestBody(), RegisterNodesRequest.class);
            } catch (JsonProcessingException e) {
                return sendError(exchange, 400, "invalid_json", "Failed to parse register request");
            }
            if (req == null || req.nodes == null || req.nodes.isEmpty()) {
                return sendError(exchange, 400, "missing_nodes", "Please supply a valid list of nodes");
            }
            List<String> registered = new ArrayList<>();
            for (String address : req.nodes) {
                try {
                    registered.add(node.registerPeer(address));
                } catch (InvalidAddressException e) {
                    return sendError(exchange, 400, "invalid_address", e.getMessage());
                }
            }
            ObjectNode resp = mapper.createObjectNode();
            resp.put("message", "New nodes have been added");
            resp.set("registered", mapper.valueToTree(registered));
            resp.set("total_nodes", mapper.valueToTree(node.peers().list()));
            return sendJson(exchange, 201, resp);
        }
    }

    class ListNodesHandler extends JsonEndpoint {
        ListNodesHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            ObjectNode resp = mapper.createObjectNode();
            resp.set("nodes", mapper.valueToTree(node.peers().list()));
            return sendJson(exchange, 200, resp);
        }
    }

    class ResolveHandler extends JsonEndpoint {
        ResolveHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            boolean replaced = resolver.resolve();
            List<Block> chain = node.chain();
            ObjectNode resp = mapper.createObjectNode();
            resp.put("message", replaced ? "Our chain was replaced" : "Our chain is authoritative");
            resp.put("replaced", replaced);
            resp.set("chain", mapper.valueToTree(chain));
            resp.put("length", chain.size());
            return sendJson(exchange, 200, resp);
        }
    }

    class MetricsHandler extends JsonEndpoint {
        MetricsHandler() { super("GET"); }

        @Override
        int serve(HttpExchange exchange) throws IOException {
            byte[] body = BlockMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
            return 200;
        }
    }

    public static class NewTransactionRequest {
        public String nama;
        public String nomor_sertifikat;
        public String lokasi;
        public String luas;
        public String file_hash;
        public String file_base64;
    }

    public static class RegisterNodesRequest {
        public List<String> nodes;
    }

    private int sendJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }

    private int sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("error", code);
        body.put("message", message);
        return sendJson(exchange, status, body);
    }
}
