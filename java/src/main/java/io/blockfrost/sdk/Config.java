package io.blockfrost.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable configuration container used to bootstrap {@link BlockfrostApi} instances.
 */
public final class Config {

    public static final String CARDANO_MAINNET = "https://cardano-mainnet.blockfrost.io/api/v0";
    public static final String CARDANO_PREPROD = "https://cardano-preprod.blockfrost.io/api/v0";
    public static final String CARDANO_PREVIEW = "https://cardano-preview.blockfrost.io/api/v0";
    public static final String CARDANO_TESTNET = "https://cardano-testnet.blockfrost.io/api/v0";
    public static final String IPFS = "https://ipfs.blockfrost.io/api/v0";

    public static final String SDK_VERSION = "0.1.0";
    public static final String DEFAULT_USER_AGENT = "blockfrost-java/" + SDK_VERSION;
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final Set<Integer> DEFAULT_EXPECTED_ERROR_STATUSES = Set.of(400, 403, 404, 418, 429, 500);

    private final String baseUrl;
    private final String projectId;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final String userAgent;
    private final Set<Integer> expectedErrorStatuses;
    private final Integer defaultPageSize;
    private final UnexpectedStatusListener unexpectedStatusListener;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.projectId = builder.projectId;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.userAgent = builder.userAgent;
        this.expectedErrorStatuses = builder.expectedErrorStatuses == null
            ? null : Collections.unmodifiableSet(new LinkedHashSet<>(builder.expectedErrorStatuses));
        this.defaultPageSize = builder.defaultPageSize;
        this.unexpectedStatusListener = builder.unexpectedStatusListener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("ProjectID is required");
        }
        String resolvedProjectId = projectId.trim();

        String resolvedBaseUrl = sanitizeUrl(Optional.ofNullable(baseUrl).orElse(networkFor(resolvedProjectId)));

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        String resolvedUserAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_USER_AGENT);

        Set<Integer> resolvedStatuses = Optional.ofNullable(expectedErrorStatuses).orElse(DEFAULT_EXPECTED_ERROR_STATUSES);

        int resolvedPageSize = Optional.ofNullable(defaultPageSize).orElse(DEFAULT_PAGE_SIZE);
        if (resolvedPageSize < 1) {
            throw new IllegalArgumentException("DefaultPageSize must be >= 1");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .projectId(resolvedProjectId)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .userAgent(resolvedUserAgent)
            .expectedErrorStatuses(resolvedStatuses)
            .defaultPageSize(resolvedPageSize)
            .unexpectedStatusListener(Optional.ofNullable(unexpectedStatusListener).orElse(UnexpectedStatusListener.NONE))
            .buildInternal();
    }

    /**
     * Picks the network base URL encoded in a project id prefix ({@code mainnet...}, {@code preprod...}, etc.).
     */
    static String networkFor(String projectId) {
        String lower = projectId.toLowerCase(Locale.ROOT);
        if (lower.startsWith("preprod")) {
            return CARDANO_PREPROD;
        }
        if (lower.startsWith("preview")) {
            return CARDANO_PREVIEW;
        }
        if (lower.startsWith("testnet")) {
            return CARDANO_TESTNET;
        }
        if (lower.startsWith("ipfs")) {
            return IPFS;
        }
        return CARDANO_MAINNET;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getProjectId() {
        return projectId;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public Set<Integer> getExpectedErrorStatuses() {
        return expectedErrorStatuses;
    }

    public Integer getDefaultPageSize() {
        return defaultPageSize;
    }

    public UnexpectedStatusListener getUnexpectedStatusListener() {
        return unexpectedStatusListener;
    }

    public static final class Builder {
        private String baseUrl;
        private String projectId;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private String userAgent;
        private Set<Integer> expectedErrorStatuses;
        private Integer defaultPageSize;
        private UnexpectedStatusListener unexpectedStatusListener;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder expectedErrorStatuses(Set<Integer> expectedErrorStatuses) {
            this.expectedErrorStatuses = expectedErrorStatuses == null ? null : new LinkedHashSet<>(expectedErrorStatuses);
            return this;
        }

        public Builder defaultPageSize(Integer defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
            return this;
        }

        public Builder unexpectedStatusListener(UnexpectedStatusListener unexpectedStatusListener) {
            this.unexpectedStatusListener = unexpectedStatusListener;
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}
