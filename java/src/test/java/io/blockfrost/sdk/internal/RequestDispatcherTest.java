package io.blockfrost.sdk.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import io.blockfrost.sdk.Block;
import io.blockfrost.sdk.BlockfrostApiException;
import io.blockfrost.sdk.Config;
import io.blockfrost.sdk.DecodeException;
import io.blockfrost.sdk.Order;
import io.blockfrost.sdk.Pagination;
import io.blockfrost.sdk.TransportException;
import io.blockfrost.sdk.UnexpectedStatusListener;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RequestDispatcherTest {

    private static final String BASE = "https://cardano-mainnet.blockfrost.io/api/v0";

    private final List<String> requested = new ArrayList<>();

    @Test
    void buildsUrlWithoutQueryWhenNotPaged() {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "[]", url));

        assertEquals(BASE + "/blocks/latest", dispatcher.buildUrl("/blocks/latest", null));
    }

    @Test
    void buildsPagedUrl() {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "[]", url));

        assertEquals(BASE + "/blocks/abc/next?page=3",
            dispatcher.buildUrl("/blocks/abc/next", Pagination.page(3)));
        assertEquals(BASE + "/blocks/abc/next?page=2&count=100",
            dispatcher.buildUrl("/blocks/abc/next", Pagination.of(2, 100)));
        assertEquals(BASE + "/blocks/abc/next?page=1&count=10&order=desc",
            dispatcher.buildUrl("/blocks/abc/next", Pagination.of(1, 10).withOrder(Order.DESC)));
        assertEquals(BASE + "/assets/policy/x?from=1&page=1",
            dispatcher.buildUrl("/assets/policy/x?from=1", Pagination.page(1)));
    }

    @Test
    void rejectsPathsThatCarryPaging() {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "[]", url));

        assertThrows(IllegalArgumentException.class, () -> dispatcher.buildUrl("blocks/latest", null));
        assertThrows(IllegalArgumentException.class,
            () -> dispatcher.callPaged("/blocks/latest/txs?page=2", Pagination.page(1), String.class));
        assertTrue(requested.isEmpty());
    }

    @Test
    void decodesSingleValue() throws Exception {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "{\"is_healthy\":true}", url));

        Map<String, Boolean> health = dispatcher.call("/health", new TypeReference<Map<String, Boolean>>() {
        });

        assertEquals(Map.of("is_healthy", true), health);
        assertEquals(List.of(BASE + "/health"), requested);
    }

    @Test
    void decodesPage() throws Exception {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "[\"tx1\",\"tx2\"]", url));

        List<String> page = dispatcher.callPaged("/blocks/latest/txs", Pagination.of(1, 2), String.class);

        assertEquals(List.of("tx1", "tx2"), page);
        assertEquals(List.of(BASE + "/blocks/latest/txs?page=1&count=2"), requested);
    }

    @Test
    void decodeFailureKeepsRawText() {
        String body = "{\"not\":\"a list\"}";
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, body, url));

        DecodeException ex = assertThrows(DecodeException.class,
            () -> dispatcher.callPaged("/blocks/latest/txs", null, String.class));

        assertEquals(body, ex.getText());
        assertEquals(BASE + "/blocks/latest/txs", ex.getUrl());
        assertNotNull(ex.getCause());
        assertTrue(ex.getMessage().contains(body));
    }

    @Test
    void objectMissingRequiredFieldsIsDecodeFailure() {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "[{}]", url));

        DecodeException ex = assertThrows(DecodeException.class,
            () -> dispatcher.callPaged("/blocks/abc/next", null, Block.class));

        assertEquals("[{}]", ex.getText());
        assertNotNull(ex.getCause());
    }

    @Test
    void blockWithNullPrimitiveIsDecodeFailure() {
        String body = "{\"time\":null,\"hash\":\"h\",\"slot_leader\":\"l\",\"size\":0,\"tx_count\":0,"
            + "\"confirmations\":0}";
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, body, url));

        assertThrows(DecodeException.class, () -> dispatcher.call("/blocks/latest", Block.class));
    }

    @Test
    void scalarsAreNotCoercedToText() {
        RequestDispatcher numbers = dispatcher(url -> new RawResponse(200, "[1]", url));
        RequestDispatcher mixed = dispatcher(url -> new RawResponse(200, "[1,true]", url));

        DecodeException ex = assertThrows(DecodeException.class,
            () -> numbers.callPaged("/blocks/latest/txs", null, String.class));
        assertEquals("[1]", ex.getText());
        assertThrows(DecodeException.class, () -> mixed.callPaged("/blocks/latest/txs", null, String.class));
    }

    @Test
    void nullBodyIsDecodeFailure() {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(200, "null", url));

        DecodeException ex = assertThrows(DecodeException.class,
            () -> dispatcher.callPaged("/blocks/latest/txs", Pagination.page(1), String.class));
        assertEquals("null", ex.getText());
    }

    @Test
    void errorStatusIsClassifiedWithoutDecoding() {
        RequestDispatcher dispatcher = dispatcher(url -> new RawResponse(404,
            "{\"status_code\":404,\"error\":\"Not Found\",\"message\":\"missing\"}", url));

        BlockfrostApiException ex = assertThrows(BlockfrostApiException.class,
            () -> dispatcher.call("/blocks/nope", String.class));

        assertEquals(404, ex.getStatusCode());
        assertEquals("missing", ex.getErrorMessage());
        assertEquals(1, requested.size());
    }

    @Test
    void transportFailurePropagatesUntouched() {
        TransportException failure = new TransportException(BASE + "/health", new IOException("connection refused"));
        RequestDispatcher dispatcher = dispatcher(url -> {
            throw failure;
        });

        TransportException ex = assertThrows(TransportException.class, () -> dispatcher.call("/health", String.class));

        assertSame(failure, ex);
        assertEquals(List.of(BASE + "/health"), requested);
    }

    private RequestDispatcher dispatcher(Transport delegate) {
        Transport recording = url -> {
            requested.add(url);
            return delegate.get(url);
        };
        return new RequestDispatcher(BASE, recording,
            new ResponseClassifier(Config.DEFAULT_EXPECTED_ERROR_STATUSES, UnexpectedStatusListener.NONE));
    }
}
