package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the API root endpoint.
 */
public record Root(
    @JsonProperty(value = "url", required = true) String url,
    @JsonProperty(value = "version", required = true) String version
) {
}
