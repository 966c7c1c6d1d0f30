package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Address touched by the transactions of a block.
 */
public record AffectedAddress(
    @JsonProperty(value = "address", required = true) String address,
    @JsonProperty(value = "transactions", required = true) List<TxHash> transactions
) {
}
