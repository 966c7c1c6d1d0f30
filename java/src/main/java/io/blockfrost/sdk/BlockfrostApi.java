package io.blockfrost.sdk;

import com.fasterxml.jackson.core.type.TypeReference;
import io.blockfrost.sdk.internal.HttpTransport;
import io.blockfrost.sdk.internal.RequestDispatcher;
import io.blockfrost.sdk.internal.ResponseClassifier;
import io.blockfrost.sdk.internal.Transport;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Primary entry point for the Blockfrost API. The client is lightweight and thread-safe: create one instance per
 * project id and reuse it. Every call goes through the same dispatcher, so all endpoints share URL building,
 * authentication headers, decoding and error classification.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Each method performs exactly one HTTP GET; nothing is retried.</li>
 *   <li>Paged endpoints accept an optional {@link Pagination}. Passing {@code null} sends no paging parameters.</li>
 *   <li>{@code ...All} methods and {@link #lister(String, Class)} return a {@link Lister} that walks the pages
 *       lazily, one request per page, until the server returns an empty page or an error.</li>
 *   <li>Errors are typed: {@link TransportException}, {@link DecodeException} and {@link BlockfrostApiException}.</li>
 * </ul>
 */
public final class BlockfrostApi implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(BlockfrostApi.class.getName());

    // characters that would change the route or query of the request
    private static final String ID_RESERVED_CHARS = "/?#%&";

    private final Config config;
    private final RequestDispatcher dispatcher;

    /**
     * Constructs a new client using the supplied configuration.
     *
     * @param config caller-supplied configuration; only {@code projectId} is mandatory. Defaults are applied to a
     *               copy, so later changes to the builder do not affect this client.
     */
    public BlockfrostApi(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        Transport transport = new HttpTransport(
            this.config.getHttpClient(),
            this.config.getProjectId(),
            this.config.getUserAgent(),
            this.config.getHttpTimeout()
        );
        ResponseClassifier classifier = new ResponseClassifier(
            this.config.getExpectedErrorStatuses(),
            this.config.getUnexpectedStatusListener()
        );
        this.dispatcher = new RequestDispatcher(this.config.getBaseUrl(), transport, classifier);
        LOGGER.info(() -> String.format(Locale.ROOT, "[blockfrost-sdk] client ready for %s", this.config.getBaseUrl()));
    }

    public Config config() {
        return config;
    }

    /**
     * Fetches a single JSON value from a server-relative path such as {@code /blocks/latest}.
     */
    public <T> T get(String path, Class<T> type) throws BlockfrostException {
        return dispatcher.call(path, type);
    }

    public <T> T get(String path, TypeReference<T> type) throws BlockfrostException {
        return dispatcher.call(path, type);
    }

    /**
     * Fetches one page of a paged resource.
     *
     * @param pagination page to request; {@code null} lets the server pick its default page and size.
     */
    public <T> List<T> getPage(String path, Pagination pagination, Class<T> itemType) throws BlockfrostException {
        return dispatcher.callPaged(path, pagination, itemType);
    }

    /**
     * Lazily walks every page of {@code path}, starting at page 1 with the configured default page size.
     */
    public <T> Lister<T> lister(String path, Class<T> itemType) {
        return lister(path, itemType, 1);
    }

    public <T> Lister<T> lister(String path, Class<T> itemType, int startPage) {
        return lister(path, itemType, startPage, null);
    }

    public <T> Lister<T> lister(String path, Class<T> itemType, int startPage, Order order) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(itemType, "itemType");
        return new Lister<>(
            pagination -> dispatcher.callPaged(path, pagination, itemType),
            startPage,
            config.getDefaultPageSize(),
            order
        );
    }

    public Root root() throws BlockfrostException {
        return get("/", Root.class);
    }

    public Health health() throws BlockfrostException {
        return get("/health", Health.class);
    }

    public HealthClock healthClock() throws BlockfrostException {
        return get("/health/clock", HealthClock.class);
    }

    public Block blocksLatest() throws BlockfrostException {
        return get("/blocks/latest", Block.class);
    }

    public Block blocksById(String hashOrNumber) throws BlockfrostException {
        return get("/blocks/" + requireId(hashOrNumber), Block.class);
    }

    public Block blocksSlot(long slotNumber) throws BlockfrostException {
        return get("/blocks/slot/" + slotNumber, Block.class);
    }

    public Block blocksByEpochAndSlot(long epochNumber, long slotNumber) throws BlockfrostException {
        return get("/blocks/epoch/" + epochNumber + "/slot/" + slotNumber, Block.class);
    }

    public List<String> blocksLatestTxs(Pagination pagination) throws BlockfrostException {
        return getPage("/blocks/latest/txs", pagination, String.class);
    }

    public List<Block> blocksNext(String hashOrNumber, Pagination pagination) throws BlockfrostException {
        return getPage("/blocks/" + requireId(hashOrNumber) + "/next", pagination, Block.class);
    }

    public List<Block> blocksPrevious(String hashOrNumber, Pagination pagination) throws BlockfrostException {
        return getPage("/blocks/" + requireId(hashOrNumber) + "/previous", pagination, Block.class);
    }

    public List<String> blocksTxs(String hashOrNumber, Pagination pagination) throws BlockfrostException {
        return getPage("/blocks/" + requireId(hashOrNumber) + "/txs", pagination, String.class);
    }

    public List<AffectedAddress> blocksAffectedAddresses(String hashOrNumber, Pagination pagination)
        throws BlockfrostException {
        return getPage("/blocks/" + requireId(hashOrNumber) + "/addresses", pagination, AffectedAddress.class);
    }

    public Lister<Block> blocksNextAll(String hashOrNumber) {
        return lister("/blocks/" + requireId(hashOrNumber) + "/next", Block.class);
    }

    public Lister<Block> blocksPreviousAll(String hashOrNumber) {
        return lister("/blocks/" + requireId(hashOrNumber) + "/previous", Block.class);
    }

    public Lister<String> blocksTxsAll(String hashOrNumber) {
        return lister("/blocks/" + requireId(hashOrNumber) + "/txs", String.class);
    }

    public Lister<AffectedAddress> blocksAffectedAddressesAll(String hashOrNumber) {
        return lister("/blocks/" + requireId(hashOrNumber) + "/addresses", AffectedAddress.class);
    }

    /**
     * Closes the client. Currently a no-op because {@link java.net.http.HttpClient} needs no explicit shutdown.
     */
    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    private static String requireId(String hashOrNumber) {
        if (hashOrNumber == null || hashOrNumber.isBlank()) {
            throw new IllegalArgumentException("hash or number is required");
        }
        String id = hashOrNumber.trim();
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (ID_RESERVED_CHARS.indexOf(c) >= 0 || Character.isWhitespace(c)) {
                throw new IllegalArgumentException("hash or number must not contain '" + c + "': " + hashOrNumber);
            }
        }
        return id;
    }
}
