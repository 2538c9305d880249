package io.landledger.core.consensus;

import io.landledger.core.protocol.Hashes;

/**
 * Proof-of-Work over consecutive proofs:
 * - a proof p is valid after lastProof when SHA-256("{lastProof}{p}") starts
 *   with {@code difficulty} zero hex characters;
 * - mining returns the smallest such non-negative p.
 *
 * Example:
 *   difficulty = 4  -> hex digest must start with "0000" (two 0x00 bytes).
 *
 * Difficulty is fixed for the life of the instance. The search is CPU bound,
 * has no timeout and ignores interrupts; run it off any lock you hold.
 */
public final class ProofOfWork {

    /** Hex characters in a SHA-256 digest. */
    public static final int MAX_DIFFICULTY = 64;

    private final int difficulty;

    public ProofOfWork(int difficulty) {
        if (difficulty < 0 || difficulty > MAX_DIFFICULTY) {
            throw new IllegalArgumentException("difficulty must be within 0.." + MAX_DIFFICULTY + ", got " + difficulty);
        }
        this.difficulty = difficulty;
    }

    public int difficulty() {
        return difficulty;
    }

    /** Smallest non-negative proof that is valid after {@code lastProof}. */
    public long proofOfWork(long lastProof) {
        long proof = 0L;
        while (!validProof(lastProof, proof)) {
            proof++;
        }
        return proof;
    }

    /** Quick check: does this proof meet the difficulty after lastProof? */
    public boolean validProof(long lastProof, long proof) {
        if (difficulty == 0) return true;
        byte[] digest = Hashes.sha256(Long.toString(lastProof) + proof);
        return hasLeadingZeroNibbles(digest, difficulty);
    }

    // ---------- helpers ----------

    /**
     * Check for N leading zero hex characters in the digest.
     * Fast path: whole zero bytes first, then the high nibble of the next byte.
     */
    private static boolean hasLeadingZeroNibbles(byte[] digest, int requiredNibbles) {
        int fullBytes = requiredNibbles / 2;
        for (int i = 0; i < fullBytes; i++) {
            if (digest[i] != 0) return false;
        }
        if (requiredNibbles % 2 == 0) return true;
        return (digest[fullBytes] & 0xf0) == 0;
    }
}
