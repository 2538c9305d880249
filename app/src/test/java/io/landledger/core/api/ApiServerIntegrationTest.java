package io.landledger.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.landledger.core.ChainFixtures;
import io.landledger.core.consensus.ConsensusResolver;
import io.landledger.core.mempool.MempoolSynchronizer;
import io.landledger.core.node.Node;
import io.landledger.core.node.NodeConfig;
import io.landledger.core.p2p.HttpPeerClient;
import io.landledger.core.protocol.Hashes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApiServerIntegrationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private final HttpPeerClient peerClient = new HttpPeerClient(Duration.ofSeconds(2));

    private final List<ApiServer> servers = new ArrayList<>();
    private final List<Node> nodes = new ArrayList<>();

    @AfterEach
    void tearDown() {
        servers.forEach(ApiServer::stop);
        nodes.forEach(Node::close);
    }

    @Test
    void twoNodesConvergeThroughRegisterAndResolve() throws Exception {
        int portA = startNode();
        int portB = startNode();

        HttpResponse<String> submitted = post(portA, "/transactions/new", mapper.createObjectNode()
                .put("nama", "Budi Santoso")
                .put("nomor_sertifikat", "SHM-0001")
                .put("lokasi", "Sleman")
                .put("luas", "120")
                .toString());
        assertEquals(201, submitted.statusCode());
        String txid = mapper.readTree(submitted.body()).get("txid").asText();

        HttpResponse<String> mined = get(portA, "/mine");
        assertEquals(200, mined.statusCode());
        JsonNode minedBody = mapper.readTree(mined.body());
        assertEquals(2, minedBody.get("index").asInt());
        assertEquals(txid, minedBody.get("transactions").get(0).get("txid").asText());

        HttpResponse<String> registered = post(portB, "/nodes/register",
                "{\"nodes\":[\"http://127.0.0.1:" + portA + "\"]}");
        assertEquals(201, registered.statusCode());
        assertTrue(registered.body().contains("127.0.0.1:" + portA));

        HttpResponse<String> resolved = get(portB, "/nodes/resolve");
        assertEquals(200, resolved.statusCode());
        JsonNode resolvedBody = mapper.readTree(resolved.body());
        assertTrue(resolvedBody.get("replaced").asBoolean());
        assertEquals(2, resolvedBody.get("length").asInt());

        JsonNode chainA = mapper.readTree(get(portA, "/chain").body());
        JsonNode chainB = mapper.readTree(get(portB, "/chain").body());
        assertEquals(chainA.get("chain"), chainB.get("chain"));
        assertEquals(2, chainB.get("length").asInt());

        JsonNode again = mapper.readTree(get(portB, "/nodes/resolve").body());
        assertFalse(again.get("replaced").asBoolean());
    }

    @Test
    void pendingTransactionsSpreadOverHttp() throws Exception {
        int portA = startNode();
        startNode();
        Node nodeB = nodes.get(1);
        nodes.get(0).submitTransaction(ChainFixtures.tx("from-a", "10"));
        nodeB.registerPeer("127.0.0.1:" + portA);

        int added = new MempoolSynchronizer(nodeB, peerClient).synchronize();

        assertEquals(1, added);
        assertTrue(nodeB.mempool().contains("from-a"));
    }

    @Test
    void mineWithEmptyMempoolIsRejected() throws Exception {
        int port = startNode();
        HttpResponse<String> response = get(port, "/mine");
        assertEquals(400, response.statusCode());
        assertTrue(response.body().contains("empty_mempool"));
        assertEquals(1, nodes.get(0).chainLength());
    }

    @Test
    void invalidSubmissionsAreRejected() throws Exception {
        int port = startNode();

        HttpResponse<String> missingField = post(port, "/transactions/new", "{\"nama\":\"Budi\"}");
        assertEquals(400, missingField.statusCode());
        assertTrue(missingField.body().contains("invalid_transaction"));

        HttpResponse<String> badJson = post(port, "/transactions/new", "{nama");
        assertEquals(400, badJson.statusCode());
        assertTrue(badJson.body().contains("invalid_json"));

        assertTrue(nodes.get(0).mempool().isEmpty());
    }

    @Test
    void fileContentIsFingerprinted() throws Exception {
        int port = startNode();
        byte[] scan = "scanned certificate".getBytes(StandardCharsets.UTF_8);

        HttpResponse<String> response = post(port, "/transactions/new", mapper.createObjectNode()
                .put("nama", "Siti")
                .put("nomor_sertifikat", "SHM-77")
                .put("lokasi", "Bantul")
                .put("luas", "300")
                .put("file_base64", Base64.getEncoder().encodeToString(scan))
                .toString());
        assertEquals(201, response.statusCode());

        JsonNode mempool = mapper.readTree(get(port, "/mempool").body());
        assertEquals(1, mempool.size());
        assertEquals(Hashes.sha256Hex(scan), mempool.get(0).get("file_hash").asText());
    }

    @Test
    void peerRegistrationValidatesInput() throws Exception {
        int port = startNode();

        HttpResponse<String> missing = post(port, "/nodes/register", "{}");
        assertEquals(400, missing.statusCode());
        assertTrue(missing.body().contains("missing_nodes"));

        HttpResponse<String> invalid = post(port, "/nodes/register", "{\"nodes\":[\"not a url\"]}");
        assertEquals(400, invalid.statusCode());
        assertTrue(invalid.body().contains("invalid_address"));

        post(port, "/nodes/register", "{\"nodes\":[\"localhost:5001\",\"http://localhost:5001\"]}");
        JsonNode listed = mapper.readTree(get(port, "/nodes").body());
        assertEquals(1, listed.get("nodes").size());
        assertEquals("localhost:5001", listed.get("nodes").get(0).asText());
    }

    @Test
    void wrongVerbIsRejected() throws Exception {
        int port = startNode();
        HttpResponse<String> response = post(port, "/chain", "{}");
        assertEquals(405, response.statusCode());
        assertTrue(response.body().contains("method_not_allowed"));
    }

    @Test
    void validateAndMetricsEndpointsAnswer() throws Exception {
        int port = startNode();

        JsonNode audit = mapper.readTree(get(port, "/chain/validate").body());
        assertTrue(audit.get("valid").asBoolean());
        assertEquals(0, audit.get("issues").size());

        get(port, "/chain");
        HttpResponse<String> metrics = get(port, "/metrics");
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("http.server.requests"));
    }

    @Test
    void metricsEndpointChecksPathAndVerb() throws Exception {
        int port = startNode();

        HttpResponse<String> nested = get(port, "/metrics/anything");
        assertEquals(404, nested.statusCode());
        assertTrue(nested.body().contains("not_found"));

        HttpResponse<String> posted = post(port, "/metrics", "");
        assertEquals(405, posted.statusCode());
        assertTrue(posted.body().contains("method_not_allowed"));
    }

    private int startNode() throws Exception {
        int port = freePort();
        Node node = Node.inMemory(NodeConfig.defaultLocal().withDifficulty(ChainFixtures.DIFFICULTY));
        node.start();
        nodes.add(node);
        ApiServer server = new ApiServer(node, new ConsensusResolver(node, peerClient), "127.0.0.1", port);
        server.start();
        servers.add(server);
        return port;
    }

    private HttpResponse<String> get(int port, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .GET()
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(int port, String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(new URI("http://127.0.0.1:" + port + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws Exception {
        try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
