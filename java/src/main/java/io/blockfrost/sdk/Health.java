package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Health(@JsonProperty(value = "is_healthy", required = true) boolean healthy) {
}
