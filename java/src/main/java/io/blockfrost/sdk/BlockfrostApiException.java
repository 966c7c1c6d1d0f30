package io.blockfrost.sdk;

/**
 * Exception representing an error returned by the Blockfrost API. When the backend responds with a non-2xx status
 * the SDK hydrates this type so callers can inspect the HTTP status together with the error envelope.
 */
public final class BlockfrostApiException extends BlockfrostException {

    private static final long serialVersionUID = 1L;

    private final ResponseError responseError;

    public BlockfrostApiException(String url, ResponseError responseError) {
        super(describe(url, responseError), url, null);
        this.responseError = responseError;
    }

    /**
     * @return HTTP status code carried by the error envelope.
     */
    public int getStatusCode() {
        return responseError.statusCode();
    }

    /**
     * @return short error label, e.g. {@code "Not Found"}.
     */
    public String getError() {
        return responseError.error();
    }

    /**
     * @return human readable explanation; for unparseable bodies this is the body itself.
     */
    public String getErrorMessage() {
        return responseError.message();
    }

    public ResponseError getResponseError() {
        return responseError;
    }

    private static String describe(String url, ResponseError error) {
        return "response error:\n"
            + "  url: " + url + "\n"
            + "  status code: " + error.statusCode() + "\n"
            + "  error: " + error.error() + "\n"
            + "  message: " + error.message();
    }
}
