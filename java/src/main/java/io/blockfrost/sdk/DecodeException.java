package io.blockfrost.sdk;

/**
 * The server answered with a success status but the body did not match the expected shape.
 * The raw body is kept verbatim for diagnostics.
 */
public final class DecodeException extends BlockfrostException {

    private static final long serialVersionUID = 1L;

    private final String text;

    public DecodeException(String url, String text, Throwable cause) {
        super(describe(url, text, cause == null ? "unexpected null body" : cause.getMessage()), url, cause);
        this.text = text;
    }

    /**
     * @return response body exactly as received.
     */
    public String getText() {
        return text;
    }

    private static String describe(String url, String text, String reason) {
        return "json error:\n"
            + "  url: " + url + "\n"
            + "  reason: " + reason + "\n"
            + "  text: '" + text + "'";
    }
}
