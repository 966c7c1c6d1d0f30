package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TxHash(@JsonProperty(value = "tx_hash", required = true) String txHash) {
}
