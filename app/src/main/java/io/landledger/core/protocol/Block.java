package io.landledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Block = index, timestamp, the committed transactions, the proof found by
 * mining and the link to the previous block.
 *
 * The hash is derived from the canonical content (see {@link BlockCodec#canonicalBytes}).
 * A block decoded from storage or from a peer keeps the hash it was recorded
 * with, so tampering shows up as {@code hash() != computeHash()}.
 */
public final class Block {

    /** previous_hash carried by every genesis block. */
    public static final String GENESIS_PREVIOUS_HASH = "0";

    private final long index;
    private final long timestamp;
    private final List<Transaction> transactions;
    private final long proof;
    private final String previousHash;
    private final String hash;

    public Block(long index, long timestamp, List<Transaction> txs, long proof, String previousHash) {
        this(index, timestamp, txs, proof, previousHash, null);
    }

    @JsonCreator
    private Block(@JsonProperty("index") long index,
                  @JsonProperty("timestamp") long timestamp,
                  @JsonProperty("transactions") List<Transaction> txs,
                  @JsonProperty("proof") long proof,
                  @JsonProperty("previous_hash") String previousHash,
                  @JsonProperty("hash") String recordedHash) {
        this.index = index;
        this.timestamp = timestamp;
        this.transactions = txs != null ? List.copyOf(txs) : List.of();
        this.proof = proof;
        this.previousHash = previousHash;
        this.hash = recordedHash != null ? recordedHash : computeHash();
    }

    /** Rebuild a block exactly as it was recorded, hash included. */
    public static Block restore(long index, long timestamp, List<Transaction> txs, long proof,
                                String previousHash, String recordedHash) {
        return new Block(index, timestamp, txs, proof, previousHash, recordedHash);
    }

    @JsonProperty("index") public long index() { return index; }
    @JsonProperty("timestamp") public long timestamp() { return timestamp; }
    @JsonProperty("transactions") public List<Transaction> transactions() { return transactions; }
    @JsonProperty("proof") public long proof() { return proof; }
    @JsonProperty("previous_hash") public String previousHash() { return previousHash; }
    @JsonProperty("hash") public String hash() { return hash; }

    /** SHA-256 over the canonical content, ignoring the recorded hash. */
    public String computeHash() {
        return Hashes.sha256Hex(BlockCodec.canonicalBytes(this));
    }

    public boolean hashMatchesContent() {
        return computeHash().equals(hash);
    }

    Map<String, Object> canonicalFields() {
        List<Map<String, Object>> txs = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) {
            txs.add(tx.canonicalFields());
        }
        Map<String, Object> fields = new TreeMap<>();
        fields.put("index", index);
        fields.put("timestamp", timestamp);
        fields.put("transactions", txs);
        fields.put("previous_hash", previousHash);
        fields.put("proof", proof);
        return fields;
    }

    @Override public String toString() {
        return "Block{index=" + index + ", txs=" + transactions.size() + ", hash=" + shortHash() + "}";
    }

    private String shortHash() {
        return hash == null || hash.length() < 8 ? String.valueOf(hash) : hash.substring(0, 8) + "…";
    }
}
