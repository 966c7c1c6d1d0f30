package io.blockfrost.sdk;

/**
 * Receives a diagnostic event whenever an error response carries a status outside the configured expected set.
 * Classification of the response continues regardless of what the listener does.
 */
@FunctionalInterface
public interface UnexpectedStatusListener {

    UnexpectedStatusListener NONE = (statusCode, url) -> {
    };

    void onUnexpectedStatus(int statusCode, String url);
}
