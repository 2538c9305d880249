package io.landledger.core.consensus;

import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.ChainMessage;

import java.util.ArrayList;
import java.util.List;

/**
 * Full-chain integrity rules:
 * - genesis sits at index 1 and links to the "0" sentinel;
 * - every block's index is its predecessor's plus one;
 * - every block's previous_hash equals the predecessor's recorded hash;
 * - every block's recorded hash matches its content;
 * - every proof is valid after the predecessor's proof.
 */
public final class ChainValidator {

    private final ProofOfWork pow;

    public ChainValidator(ProofOfWork pow) {
        this.pow = pow;
    }

    /** First problem found in the chain, or ok. */
    public ValidationResult validate(List<Block> chain) {
        List<ValidationResult> issues = inspect(chain, true);
        return issues.isEmpty() ? ValidationResult.ok() : issues.get(0);
    }

    /** Validate a peer's reply, including that the reported length matches the blocks sent. */
    public ValidationResult validate(ChainMessage message) {
        if (message.length() != message.chain().size()) {
            return ValidationResult.error(ChainError.LENGTH_MISMATCH, -1L,
                    "Reported length " + message.length() + " but " + message.chain().size() + " blocks");
        }
        return validate(message.chain());
    }

    /** Every problem in the chain, one entry per failed check, in chain order. */
    public List<ValidationResult> audit(List<Block> chain) {
        return inspect(chain, false);
    }

    private List<ValidationResult> inspect(List<Block> chain, boolean stopAtFirst) {
        List<ValidationResult> issues = new ArrayList<>();
        if (chain == null || chain.isEmpty()) {
            issues.add(ValidationResult.error(ChainError.EMPTY_CHAIN, -1L, "Chain has no blocks"));
            return issues;
        }

        Block genesis = chain.get(0);
        if (genesis.index() != 1L) {
            issues.add(ValidationResult.error(ChainError.BAD_INDEX, genesis.index(),
                    "Genesis index must be 1, got " + genesis.index()));
        }
        if (!Block.GENESIS_PREVIOUS_HASH.equals(genesis.previousHash())) {
            issues.add(ValidationResult.error(ChainError.BAD_GENESIS, genesis.index(),
                    "Genesis previous_hash must be \"" + Block.GENESIS_PREVIOUS_HASH + "\""));
        }
        if (!genesis.hashMatchesContent()) {
            issues.add(hashMismatch(genesis));
        }
        if (stopAtFirst && !issues.isEmpty()) {
            return issues;
        }

        for (int i = 1; i < chain.size(); i++) {
            Block prev = chain.get(i - 1);
            Block curr = chain.get(i);

            if (curr.index() != prev.index() + 1) {
                issues.add(ValidationResult.error(ChainError.BAD_INDEX, curr.index(),
                        "Expected index " + (prev.index() + 1) + ", got " + curr.index()));
            }
            if (curr.previousHash() == null || !curr.previousHash().equals(prev.hash())) {
                issues.add(ValidationResult.error(ChainError.BROKEN_LINK, curr.index(),
                        "previous_hash does not match block " + prev.index()));
            }
            if (!curr.hashMatchesContent()) {
                issues.add(hashMismatch(curr));
            }
            if (!pow.validProof(prev.proof(), curr.proof())) {
                issues.add(ValidationResult.error(ChainError.PROOF_INVALID, curr.index(),
                        "Proof " + curr.proof() + " does not meet difficulty " + pow.difficulty()));
            }
            if (stopAtFirst && !issues.isEmpty()) {
                return issues;
            }
        }
        return issues;
    }

    private static ValidationResult hashMismatch(Block block) {
        return ValidationResult.error(ChainError.HASH_MISMATCH, block.index(),
                "Recorded hash does not match block content");
    }
}
