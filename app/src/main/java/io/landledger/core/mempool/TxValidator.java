package io.landledger.core.mempool;

import io.landledger.core.protocol.Hashes;
import io.landledger.core.protocol.Transaction;

/** Submission-time checks for a new certificate record. */
public class TxValidator {

    public void validate(Transaction tx) {
        if (tx == null) {
            throw new IllegalArgumentException("Transaction required");
        }
        requireText(tx.nama(), "nama");
        requireText(tx.nomorSertifikat(), "nomor_sertifikat");
        requireText(tx.lokasi(), "lokasi");
        requireText(tx.luas(), "luas");
        if (tx.fileHash() != null && !Hashes.isSha256Hex(tx.fileHash())) {
            throw new IllegalArgumentException("file_hash must be a 64-character hex SHA-256 digest");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing " + field);
        }
    }
}
