package io.blockfrost.sdk.internal;

/**
 * Status and body of one HTTP exchange, tagged with the URL that produced it.
 */
public record RawResponse(int statusCode, String body, String url) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
