package io.landledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;

/**
 * JSON encoding of blocks for storage and for the peer wire format, plus the
 * canonical form that block hashes are computed over.
 */
public final class BlockCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    // Sorted keys at every level: equal content always gives equal bytes.
    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private BlockCodec(){}

    /** Canonical bytes of index, timestamp, transactions, previous_hash and proof. */
    public static byte[] canonicalBytes(Block block) {
        try {
            return CANONICAL.writeValueAsBytes(block.canonicalFields());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode block " + block.index(), e);
        }
    }

    public static byte[] toBytes(Block block) {
        try {
            return MAPPER.writeValueAsBytes(block);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode block " + block.index(), e);
        }
    }

    public static Block fromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, Block.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed Block bytes", ex);
        }
    }

    public static ChainMessage chainMessageFromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, ChainMessage.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed chain message", ex);
        }
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
