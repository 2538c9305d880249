package io.landledger.core.p2p;

import io.landledger.core.protocol.BlockCodec;
import io.landledger.core.protocol.ChainMessage;
import io.landledger.core.protocol.Transaction;
import io.landledger.core.protocol.TransactionCodec;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Fetches {@code GET /chain} and {@code GET /mempool} from peers over HTTP.
 * Both the connect and the whole request are bounded by the configured timeout.
 */
public final class HttpPeerClient implements PeerClient {

    private final HttpClient http;
    private final Duration timeout;

    public HttpPeerClient(Duration timeout) {
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public ChainMessage fetchChain(String peer) {
        return get(peer, "/chain", BlockCodec::chainMessageFromBytes);
    }

    @Override
    public List<Transaction> fetchMempool(String peer) {
        return get(peer, "/mempool", TransactionCodec::listFromBytes);
    }

    private <T> T get(String peer, String path, Function<byte[], T> decoder) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://" + peer + path))
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<byte[]> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new PeerUnavailableException(peer, "GET " + path + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PeerUnavailableException(peer, "Interrupted while calling " + peer, e);
        }
        if (response.statusCode() != 200) {
            throw new PeerUnavailableException(peer, "GET " + path + " returned HTTP " + response.statusCode());
        }
        try {
            return decoder.apply(response.body());
        } catch (IllegalArgumentException e) {
            throw new PeerUnavailableException(peer, "Undecodable " + path + " response", e);
        }
    }
}
