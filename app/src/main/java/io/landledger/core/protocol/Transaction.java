package io.landledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * A land-certificate record: who holds it (nama), the certificate number,
 * location and area, plus an optional SHA-256 fingerprint of the scanned
 * certificate file.
 *
 * Immutable. Records received from peers may carry only a txid, so no field
 * other than the id is enforced here; submission-time checks live in
 * {@link io.landledger.core.mempool.TxValidator}.
 */
public final class Transaction {

    private final String txid;
    private final String nama;
    private final String nomorSertifikat;
    private final String lokasi;
    private final String luas;
    private final String fileHash;
    private final long timestamp;

    @JsonCreator
    private Transaction(@JsonProperty("txid") String txid,
                        @JsonProperty("nama") String nama,
                        @JsonProperty("nomor_sertifikat") String nomorSertifikat,
                        @JsonProperty("lokasi") String lokasi,
                        @JsonProperty("luas") String luas,
                        @JsonProperty("file_hash") String fileHash,
                        @JsonProperty("timestamp") long timestamp) {
        this.txid = txid;
        this.nama = nama;
        this.nomorSertifikat = nomorSertifikat;
        this.lokasi = lokasi;
        this.luas = luas;
        this.fileHash = fileHash;
        this.timestamp = timestamp;
    }

    public static Builder builder() { return new Builder(); }

    /** Fresh 32-char hex id. */
    public static String newTxid() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static final class Builder {
        private String txid;
        private String nama;
        private String nomorSertifikat;
        private String lokasi;
        private String luas;
        private String fileHash;
        private long timestamp = System.currentTimeMillis();

        public Builder txid(String id) { this.txid = id; return this; }
        public Builder nama(String n) { this.nama = n; return this; }
        public Builder nomorSertifikat(String n) { this.nomorSertifikat = n; return this; }
        public Builder lokasi(String l) { this.lokasi = l; return this; }
        public Builder luas(String l) { this.luas = l; return this; }
        public Builder fileHash(String h) { this.fileHash = h; return this; }
        public Builder timestamp(long ts) { this.timestamp = ts; return this; }

        public Transaction build() {
            return new Transaction(txid, nama, nomorSertifikat, lokasi, luas, fileHash, timestamp);
        }
    }

    /** Copy with the given id; every other field is kept. */
    public Transaction withTxid(String id) {
        return new Transaction(id, nama, nomorSertifikat, lokasi, luas, fileHash, timestamp);
    }

    // -------------------- getters --------------------
    @JsonProperty("txid") public String txid() { return txid; }
    @JsonProperty("nama") public String nama() { return nama; }
    @JsonProperty("nomor_sertifikat") public String nomorSertifikat() { return nomorSertifikat; }
    @JsonProperty("lokasi") public String lokasi() { return lokasi; }
    @JsonProperty("luas") public String luas() { return luas; }
    @JsonProperty("file_hash") public String fileHash() { return fileHash; }
    @JsonProperty("timestamp") public long timestamp() { return timestamp; }

    public boolean hasTxid() {
        return txid != null && !txid.isBlank();
    }

    /** Key-sorted view fed into the block digest. */
    Map<String, Object> canonicalFields() {
        Map<String, Object> fields = new TreeMap<>();
        fields.put("txid", txid);
        fields.put("nama", nama);
        fields.put("nomor_sertifikat", nomorSertifikat);
        fields.put("lokasi", lokasi);
        fields.put("luas", luas);
        fields.put("file_hash", fileHash);
        fields.put("timestamp", timestamp);
        return fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return timestamp == other.timestamp
                && Objects.equals(txid, other.txid)
                && Objects.equals(nama, other.nama)
                && Objects.equals(nomorSertifikat, other.nomorSertifikat)
                && Objects.equals(lokasi, other.lokasi)
                && Objects.equals(luas, other.luas)
                && Objects.equals(fileHash, other.fileHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(txid, nama, nomorSertifikat, lokasi, luas, fileHash, timestamp);
    }

    @Override
    public String toString() {
        return "Transaction{txid=" + txid + ", nomor_sertifikat=" + nomorSertifikat + "}";
    }
}
