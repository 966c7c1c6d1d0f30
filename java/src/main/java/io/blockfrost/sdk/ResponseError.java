package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope returned by the Blockfrost API on non-2xx responses.
 */
public record ResponseError(
    @JsonProperty("status_code") int statusCode,
    String error,
    String message
) {
}
