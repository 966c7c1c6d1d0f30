package io.blockfrost.sdk.internal;

import io.blockfrost.sdk.TransportException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} backed by {@link HttpClient}; the client's connection pool is shared by every caller.
 */
public final class HttpTransport implements Transport {

    private static final Logger LOGGER = Logger.getLogger(HttpTransport.class.getName());

    static final String PROJECT_ID_HEADER = "project_id";

    private final HttpClient httpClient;
    private final String projectId;
    private final String userAgent;
    private final Duration requestTimeout;

    public HttpTransport(HttpClient httpClient, String projectId, String userAgent, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.projectId = Objects.requireNonNull(projectId, "projectId");
        this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
    }

    @Override
    public RawResponse get(String url) throws TransportException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .GET()
                .header(PROJECT_ID_HEADER, projectId)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .build();
            LOGGER.fine(() -> "[blockfrost-sdk] GET " + url);
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException(url, ex);
        } catch (IOException | IllegalArgumentException ex) {
            LOGGER.log(Level.FINE, ex, () -> "[blockfrost-sdk] GET " + url + " failed");
            throw new TransportException(url, ex);
        }

        int status = response.statusCode();
        LOGGER.fine(() -> String.format(Locale.ROOT, "[blockfrost-sdk] GET %s -> %d", url, status));
        return new RawResponse(status, response.body() == null ? "" : response.body(), url);
    }
}
