package io.blockfrost.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.blockfrost.sdk.BlockfrostApiException;
import io.blockfrost.sdk.Config;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResponseClassifierTest {

    private static final String URL = "https://cardano-mainnet.blockfrost.io/api/v0/blocks/xyz";

    private final List<String> events = new ArrayList<>();
    private final ResponseClassifier classifier = new ResponseClassifier(
        Config.DEFAULT_EXPECTED_ERROR_STATUSES,
        (status, url) -> events.add(status + " " + url)
    );

    @Test
    void returnsStructuredEnvelopeAsIs() {
        String body = "{\"status_code\":404,\"error\":\"Not Found\",\"message\":\"The requested component has not been found.\"}";

        BlockfrostApiException ex = classifier.classify(new RawResponse(404, body, URL));

        assertEquals(404, ex.getStatusCode());
        assertEquals("Not Found", ex.getError());
        assertEquals("The requested component has not been found.", ex.getErrorMessage());
        assertEquals(URL, ex.getUrl());
        assertTrue(events.isEmpty());
    }

    @Test
    void envelopeStatusWinsOverHttpStatus() {
        String body = "{\"status_code\":402,\"error\":\"Project Over Limit\",\"message\":\"Usage is over limit.\"}";

        BlockfrostApiException ex = classifier.classify(new RawResponse(429, body, URL));

        assertEquals(402, ex.getStatusCode());
        assertEquals("Project Over Limit", ex.getError());
    }

    @Test
    void validJsonThatIsNotAnEnvelopeIsPrettyPrinted() throws Exception {
        String body = "{\"detail\":\"upstream exploded\",\"codes\":[1,2]}";

        BlockfrostApiException ex = classifier.classify(new RawResponse(500, body, URL));

        JsonNode node = Json.mapper().readTree(body);
        assertEquals(500, ex.getStatusCode());
        assertEquals(ResponseClassifier.UNPARSEABLE_BODY_ERROR, ex.getError());
        assertEquals(Json.prettyPrint(node), ex.getErrorMessage());
        assertTrue(ex.getErrorMessage().contains("\n"));
    }

    @Test
    void envelopeWithWrongFieldTypesFallsBack() throws Exception {
        String body = "{\"status_code\":\"400\",\"error\":\"Bad Request\",\"message\":\"oops\"}";

        BlockfrostApiException ex = classifier.classify(new RawResponse(400, body, URL));

        assertEquals(400, ex.getStatusCode());
        assertEquals(ResponseClassifier.UNPARSEABLE_BODY_ERROR, ex.getError());
        assertEquals(Json.prettyPrint(Json.mapper().readTree(body)), ex.getErrorMessage());
    }

    @Test
    void envelopeStatusOutsideUnsignedShortRangeFallsBack() throws Exception {
        for (String status : List.of("-1", "70000")) {
            String body = "{\"status_code\":" + status + ",\"error\":\"Internal Server Error\",\"message\":\"boom\"}";

            BlockfrostApiException ex = classifier.classify(new RawResponse(500, body, URL));

            assertEquals(500, ex.getStatusCode());
            assertEquals(ResponseClassifier.UNPARSEABLE_BODY_ERROR, ex.getError());
            assertEquals(Json.prettyPrint(Json.mapper().readTree(body)), ex.getErrorMessage());
        }
    }

    @Test
    void envelopeStatusAtRangeBoundsIsAccepted() {
        String body = "{\"status_code\":65535,\"error\":\"Odd\",\"message\":\"edge\"}";

        BlockfrostApiException ex = classifier.classify(new RawResponse(500, body, URL));

        assertEquals(65535, ex.getStatusCode());
        assertEquals("Odd", ex.getError());
    }

    @Test
    void nonJsonBodyIsKeptVerbatim() {
        String body = "<html><body>502 Bad Gateway</body></html>";

        BlockfrostApiException ex = classifier.classify(new RawResponse(502, body, URL));

        assertEquals(502, ex.getStatusCode());
        assertEquals(ResponseClassifier.UNPARSEABLE_BODY_ERROR, ex.getError());
        assertEquals(body, ex.getErrorMessage());
    }

    @Test
    void emptyBodyIsKeptVerbatim() {
        BlockfrostApiException ex = classifier.classify(new RawResponse(403, "", URL));

        assertEquals(403, ex.getStatusCode());
        assertEquals("", ex.getErrorMessage());
    }

    @Test
    void jsonWithTrailingGarbageIsNotJson() {
        String body = "{\"a\":1} trailing";

        BlockfrostApiException ex = classifier.classify(new RawResponse(500, body, URL));

        assertEquals(body, ex.getErrorMessage());
    }

    @Test
    void unexpectedStatusEmitsDiagnosticEventOnly() {
        String body = "{\"status_code\":503,\"error\":\"Service Unavailable\",\"message\":\"maintenance\"}";

        BlockfrostApiException ex = classifier.classify(new RawResponse(503, body, URL));

        assertEquals(List.of("503 " + URL), events);
        assertEquals(503, ex.getStatusCode());
        assertEquals("maintenance", ex.getErrorMessage());
    }

    @Test
    void expectedStatusSetIsConfigurable() {
        List<Integer> seen = new ArrayList<>();
        ResponseClassifier custom = new ResponseClassifier(Set.of(503), (status, url) -> seen.add(status));

        custom.classify(new RawResponse(503, "", URL));
        custom.classify(new RawResponse(404, "", URL));

        assertEquals(List.of(404), seen);
    }

    @Test
    void failingListenerDoesNotBreakClassification() {
        ResponseClassifier custom = new ResponseClassifier(Set.of(), (status, url) -> {
            throw new IllegalStateException("listener bug");
        });

        BlockfrostApiException ex = custom.classify(new RawResponse(418, "teapot", URL));

        assertEquals(418, ex.getStatusCode());
        assertEquals("teapot", ex.getErrorMessage());
    }

    @Test
    void messageRendersFullDiagnostic() {
        BlockfrostApiException ex = classifier.classify(new RawResponse(500, "plain text", URL));

        assertTrue(ex.getMessage().contains("url: " + URL));
        assertTrue(ex.getMessage().contains("status code: 500"));
        assertTrue(ex.getMessage().contains("message: plain text"));
    }
}
