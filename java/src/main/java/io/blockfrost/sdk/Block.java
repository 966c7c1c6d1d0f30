package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Block as returned by the {@code /blocks} endpoints. Optional fields are {@code null} when the server omits them;
 * the remaining fields must be present or decoding fails.
 */
public record Block(
    @JsonProperty(value = "time", required = true) long time,
    Long height,
    @JsonProperty(value = "hash", required = true) String hash,
    Long slot,
    Long epoch,
    @JsonProperty("epoch_slot") Long epochSlot,
    @JsonProperty(value = "slot_leader", required = true) String slotLeader,
    @JsonProperty(value = "size", required = true) long size,
    @JsonProperty(value = "tx_count", required = true) long txCount,
    String output,
    String fees,
    @JsonProperty("block_vrf") String blockVrf,
    @JsonProperty("previous_block") String previousBlock,
    @JsonProperty("next_block") String nextBlock,
    @JsonProperty(value = "confirmations", required = true) long confirmations
) {
}
