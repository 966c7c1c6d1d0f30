package io.blockfrost.sdk;

/**
 * Base exception thrown by the Blockfrost Java SDK.
 */
public class BlockfrostException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String url;

    public BlockfrostException(String message) {
        this(message, null, null);
    }

    public BlockfrostException(String message, Throwable cause) {
        this(message, null, cause);
    }

    protected BlockfrostException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    /**
     * @return URL of the request that failed, or {@code null} when the failure is not tied to a request.
     */
    public String getUrl() {
        return url;
    }
}
