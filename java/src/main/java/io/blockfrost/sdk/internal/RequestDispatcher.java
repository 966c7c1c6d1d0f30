package io.blockfrost.sdk.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.blockfrost.sdk.BlockfrostException;
import io.blockfrost.sdk.DecodeException;
import io.blockfrost.sdk.Pagination;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Single-call path shared by every endpoint: build the URL, perform exactly one GET, then decode or classify.
 * There is no retry at this layer.
 */
public final class RequestDispatcher {

    private static final Pattern PAGING_PARAM = Pattern.compile("[?&](page|count|order)=");

    private final String baseUrl;
    private final Transport transport;
    private final ResponseClassifier classifier;

    public RequestDispatcher(String baseUrl, Transport transport, ResponseClassifier classifier) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public <T> T call(String path, Class<T> type) throws BlockfrostException {
        return execute(buildUrl(path, null), Json.mapper().constructType(type));
    }

    public <T> T call(String path, TypeReference<T> type) throws BlockfrostException {
        return execute(buildUrl(path, null), Json.mapper().getTypeFactory().constructType(type));
    }

    /**
     * Fetches one page. A {@code null} pagination sends no paging parameters so the server defaults apply.
     */
    public <T> List<T> callPaged(String path, Pagination pagination, Class<T> itemType) throws BlockfrostException {
        if (pagination != null && PAGING_PARAM.matcher(path).find()) {
            throw new IllegalArgumentException("path must not carry paging parameters: " + path);
        }
        JavaType pageType = Json.mapper().getTypeFactory().constructCollectionType(List.class, itemType);
        return execute(buildUrl(path, pagination), pageType);
    }

    public String buildUrl(String path, Pagination pagination) {
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        String url = baseUrl + path;
        if (pagination == null) {
            return url;
        }
        return url + (path.indexOf('?') >= 0 ? '&' : '?') + pagination.toQuery();
    }

    private <T> T execute(String url, JavaType type) throws BlockfrostException {
        RawResponse response = transport.get(url);
        if (!response.isSuccess()) {
            throw classifier.classify(response);
        }

        T value;
        try {
            value = Json.mapper().readValue(response.body(), type);
        } catch (JsonProcessingException ex) {
            throw new DecodeException(url, response.body(), ex);
        }
        if (value == null) {
            throw new DecodeException(url, response.body(), null);
        }
        return value;
    }
}
