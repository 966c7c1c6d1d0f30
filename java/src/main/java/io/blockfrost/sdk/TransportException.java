package io.blockfrost.sdk;

/**
 * The HTTP exchange itself failed: DNS resolution, connection, timeout or interruption.
 * No response was classified for this URL.
 */
public final class TransportException extends BlockfrostException {

    private static final long serialVersionUID = 1L;

    public TransportException(String url, Throwable cause) {
        super(describe(url, cause), url, cause);
    }

    private static String describe(String url, Throwable cause) {
        String reason = cause == null ? "unknown" : cause.getClass().getSimpleName()
            + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
        return "transport error:\n"
            + "  url: " + url + "\n"
            + "  reason: " + reason;
    }
}
