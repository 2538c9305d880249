package io.landledger.core.p2p;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Known peers as canonical {@code host:port} strings.
 *
 * {@code "http://localhost:5001"}, {@code "localhost:5001"} and
 * {@code "http://LOCALHOST:5001/"} all end up as {@code "localhost:5001"}.
 */
public final class PeerRegistry {
    private static final Logger LOG = Logger.getLogger(PeerRegistry.class.getName());

    private final Set<String> peers = new HashSet<>();

    /**
     * Add a peer. Registering the same peer twice is a no-op.
     *
     * @return the canonical address
     * @throws InvalidAddressException when the address has no host
     */
    public String register(String address) {
        String canonical = normalize(address);
        boolean added;
        synchronized (this) {
            added = peers.add(canonical);
        }
        if (added) {
            LOG.info(() -> "Registered peer " + canonical);
        }
        return canonical;
    }

    public synchronized Set<String> list() {
        return Set.copyOf(peers);
    }

    public synchronized int size() {
        return peers.size();
    }

    /** Canonical {@code host:port} form of a peer address. */
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new InvalidAddressException("Peer address is empty");
        }
        String trimmed = address.trim();
        String withScheme = trimmed.contains("://") ? trimmed : "http://" + trimmed;

        URI uri;
        try {
            uri = new URI(withScheme);
        } catch (URISyntaxException e) {
            throw new InvalidAddressException("Invalid peer address: " + address, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new InvalidAddressException("Unsupported scheme in peer address: " + address);
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new InvalidAddressException("Peer address has no host: " + address);
        }
        int port = uri.getPort();
        if (port == -1) {
            port = "https".equals(scheme) ? 443 : 80;
        }
        return host.toLowerCase(Locale.ROOT) + ':' + port;
    }
}
