package io.blockfrost.sdk.internal;

import io.blockfrost.sdk.TransportException;

/**
 * Performs a single authenticated GET. Implementations must be safe for concurrent use.
 */
@FunctionalInterface
public interface Transport {

    RawResponse get(String url) throws TransportException;
}
