package io.landledger.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.List;

public final class TransactionCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<Transaction>> TX_LIST = new TypeReference<>() {};

    private TransactionCodec(){}

    public static byte[] toBytes(Transaction tx) {
        try {
            return MAPPER.writeValueAsBytes(tx);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode transaction " + tx.txid(), e);
        }
    }

    public static Transaction fromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, Transaction.class);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed Transaction bytes", ex);
        }
    }

    public static List<Transaction> listFromBytes(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, TX_LIST);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed transaction list", ex);
        }
    }
}
