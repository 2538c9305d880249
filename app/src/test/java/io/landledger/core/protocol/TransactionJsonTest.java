package io.landledger.core.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesSnakeCaseFieldNames() throws Exception {
        Transaction tx = Transaction.builder()
                .txid("abc123")
                .nama("Siti Aminah")
                .nomorSertifikat("SHM-0042")
                .lokasi("Bantul")
                .luas("250")
                .fileHash(Hashes.sha256Hex("scan"))
                .timestamp(42L)
                .build();

        JsonNode json = mapper.readTree(TransactionCodec.toBytes(tx));

        assertEquals("abc123", json.get("txid").asText());
        assertEquals("Siti Aminah", json.get("nama").asText());
        assertEquals("SHM-0042", json.get("nomor_sertifikat").asText());
        assertEquals("Bantul", json.get("lokasi").asText());
        assertEquals("250", json.get("luas").asText());
        assertEquals(Hashes.sha256Hex("scan"), json.get("file_hash").asText());
        assertEquals(42L, json.get("timestamp").asLong());
        assertEquals(tx, TransactionCodec.fromBytes(TransactionCodec.toBytes(tx)));
    }

    @Test
    void peerRecordWithOnlyTxidDecodes() {
        List<Transaction> txs = TransactionCodec.listFromBytes(
                "[{\"txid\":\"only-id\",\"extra\":true}]".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, txs.size());
        assertTrue(txs.get(0).hasTxid());
        assertEquals("only-id", txs.get(0).txid());
        assertNull(txs.get(0).nama());
    }

    @Test
    void malformedListIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> TransactionCodec.listFromBytes("{not json".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void newTxidIsCompactAndUnique() {
        String a = Transaction.newTxid();
        String b = Transaction.newTxid();
        assertEquals(32, a.length());
        assertFalse(a.contains("-"));
        assertNotEquals(a, b);
    }

    @Test
    void withTxidKeepsOtherFields() {
        Transaction tx = Transaction.builder().nama("A").nomorSertifikat("B").lokasi("C").luas("1").timestamp(7L).build();
        Transaction withId = tx.withTxid("x");

        assertFalse(tx.hasTxid());
        assertEquals("x", withId.txid());
        assertEquals("A", withId.nama());
        assertEquals(7L, withId.timestamp());
    }
}
