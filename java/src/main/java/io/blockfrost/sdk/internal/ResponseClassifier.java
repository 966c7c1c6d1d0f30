package io.blockfrost.sdk.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.blockfrost.sdk.BlockfrostApiException;
import io.blockfrost.sdk.ResponseError;
import io.blockfrost.sdk.UnexpectedStatusListener;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Turns an error response into a {@link BlockfrostApiException}. Never fails: bodies that are not a valid error
 * envelope are folded into a synthesized one that keeps the original text.
 */
public final class ResponseClassifier {

    private static final Logger LOGGER = Logger.getLogger(ResponseClassifier.class.getName());

    public static final String UNPARSEABLE_BODY_ERROR = "Could not parse error body to interpret the reason of the error";

    private static final int MAX_STATUS_CODE = 0xFFFF;

    private final Set<Integer> expectedStatuses;
    private final UnexpectedStatusListener listener;

    public ResponseClassifier(Set<Integer> expectedStatuses, UnexpectedStatusListener listener) {
        this.expectedStatuses = Set.copyOf(Objects.requireNonNull(expectedStatuses, "expectedStatuses"));
        this.listener = listener == null ? UnexpectedStatusListener.NONE : listener;
    }

    public BlockfrostApiException classify(RawResponse response) {
        int status = response.statusCode();
        String url = response.url();
        String body = response.body() == null ? "" : response.body();

        if (!expectedStatuses.contains(status)) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[blockfrost-sdk] status code %d was not expected (%s)", status, url));
            notifyListener(status, url);
        }

        JsonNode node = parse(body);
        ResponseError envelope = node == null ? null : envelope(node);
        if (envelope != null) {
            return new BlockfrostApiException(url, envelope);
        }
        return new BlockfrostApiException(url, new ResponseError(status, UNPARSEABLE_BODY_ERROR, reformat(node, body)));
    }

    private void notifyListener(int status, String url) {
        try {
            listener.onUnexpectedStatus(status, url);
        } catch (RuntimeException ex) {
            LOGGER.warning(() -> "[blockfrost-sdk] unexpected status listener failed: " + ex);
        }
    }

    private static JsonNode parse(String body) {
        try {
            JsonNode node = Json.mapper().readTree(body);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }

    private static ResponseError envelope(JsonNode node) {
        if (!node.isObject()) {
            return null;
        }
        JsonNode status = node.get("status_code");
        JsonNode error = node.get("error");
        JsonNode message = node.get("message");
        if (status == null || !status.canConvertToInt() || !status.isIntegralNumber()
            || error == null || !error.isTextual()
            || message == null || !message.isTextual()) {
            return null;
        }
        // status_code is an unsigned 16-bit value
        if (status.intValue() < 0 || status.intValue() > MAX_STATUS_CODE) {
            return null;
        }
        return new ResponseError(status.intValue(), error.textValue(), message.textValue());
    }

    private static String reformat(JsonNode node, String body) {
        if (node == null) {
            return body;
        }
        try {
            return Json.prettyPrint(node);
        } catch (JsonProcessingException ex) {
            return body;
        }
    }
}
