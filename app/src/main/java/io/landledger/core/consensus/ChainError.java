package io.landledger.core.consensus;

/** Reasons a chain fails validation. */
public enum ChainError {
    EMPTY_CHAIN,
    LENGTH_MISMATCH,
    BAD_GENESIS,
    BAD_INDEX,
    BROKEN_LINK,
    HASH_MISMATCH,
    PROOF_INVALID
}
