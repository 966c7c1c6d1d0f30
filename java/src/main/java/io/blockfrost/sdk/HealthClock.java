package io.blockfrost.sdk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Server time in UNIX milliseconds.
 */
public record HealthClock(@JsonProperty(value = "server_time", required = true) long serverTime) {

    public Instant toInstant() {
        return Instant.ofEpochMilli(serverTime);
    }
}
