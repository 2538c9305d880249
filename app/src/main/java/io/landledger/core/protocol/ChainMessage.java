package io.landledger.core.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Wire shape of a node's full chain: {@code {"chain": [...], "length": n}}. */
public record ChainMessage(@JsonProperty("chain") List<Block> chain,
                           @JsonProperty("length") long length) {
    public ChainMessage {
        chain = chain == null ? List.of() : List.copyOf(chain);
    }

    public static ChainMessage of(List<Block> chain) {
        return new ChainMessage(chain, chain.size());
    }
}
