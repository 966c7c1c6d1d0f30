package io.blockfrost.sdk;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * <p>
 * Lazy, pull-based walk over a paged resource. Each {@link #advance()} issues at most one request for the next page;
 * nothing is fetched ahead of demand.
 * </p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Starts at page 1, or at the start page given on construction. The page size never changes.</li>
 *   <li>A non-empty page moves the cursor forward by exactly one page.</li>
 *   <li>An empty page ends the sequence cleanly. A failed request ends it with that error, delivered once.</li>
 *   <li>After the end or the error every further call answers {@link ListerStep.Kind#END} without touching the
 *       network. To start again, create a new lister.</li>
 * </ul>
 *
 * <p>
 * A lister is not reentrant: one advance must complete before the next one starts. Distinct listers may run
 * concurrently. Abandoning a lister early needs no cleanup.
 * </p>
 */
public final class Lister<T> {

    private static final Logger LOGGER = Logger.getLogger(Lister.class.getName());

    private enum State {
        READY,
        FETCHING,
        EXHAUSTED,
        FAILED
    }

    private final PageFetcher<T> fetcher;
    private final Integer pageSize;
    private final Order order;
    private final AtomicReference<State> state = new AtomicReference<>(State.READY);
    private int currentPage;

    public Lister(PageFetcher<T> fetcher, Integer pageSize) {
        this(fetcher, 1, pageSize, null);
    }

    public Lister(PageFetcher<T> fetcher, int startPage, Integer pageSize, Order order) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        Pagination first = new Pagination(startPage, pageSize, order);
        this.currentPage = first.page();
        this.pageSize = pageSize;
        this.order = order;
    }

    /**
     * Fetches the next page.
     *
     * @return {@link ListerStep.Kind#PAGE} with the page's items, {@link ListerStep.Kind#END} once the resource ran
     *         out of data (or the sequence is already over), or {@link ListerStep.Kind#FAILED} carrying the error of
     *         the request that ended the sequence.
     * @throws IllegalStateException when another advance on this lister is still in flight.
     */
    public ListerStep<T> advance() {
        State current = state.get();
        if (current == State.EXHAUSTED || current == State.FAILED) {
            return ListerStep.end();
        }
        if (!state.compareAndSet(State.READY, State.FETCHING)) {
            throw new IllegalStateException("advance already in progress on this lister");
        }

        int page = currentPage;
        List<T> items;
        try {
            items = fetcher.fetch(new Pagination(page, pageSize, order));
        } catch (BlockfrostException ex) {
            state.set(State.FAILED);
            LOGGER.fine(() -> String.format(Locale.ROOT, "[blockfrost-sdk] lister failed on page %d", page));
            return ListerStep.failed(page, ex);
        } catch (RuntimeException ex) {
            state.set(State.FAILED);
            throw ex;
        }

        if (items == null || items.isEmpty()) {
            state.set(State.EXHAUSTED);
            LOGGER.fine(() -> String.format(Locale.ROOT, "[blockfrost-sdk] lister exhausted at page %d", page));
            return ListerStep.end();
        }

        currentPage = page + 1;
        state.set(State.READY);
        return ListerStep.page(page, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    /**
     * Checked variant of {@link #advance()}.
     *
     * @return the next page, or empty once the sequence is over.
     * @throws BlockfrostException the error that ended the sequence; thrown once, later calls return empty.
     */
    public Optional<List<T>> nextPage() throws BlockfrostException {
        ListerStep<T> step = advance();
        if (step.isFailed()) {
            throw step.error();
        }
        return step.isPage() ? Optional.of(step.items()) : Optional.empty();
    }

    /**
     * Pages as a lazy sequential stream. {@code pages().limit(n)} issues at most {@code n} requests.
     * The terminal error surfaces as {@link UncheckedBlockfrostException}.
     */
    public Stream<List<T>> pages() {
        Spliterator<List<T>> spliterator = new Spliterators.AbstractSpliterator<List<T>>(
            Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super List<T>> action) {
                ListerStep<T> step = advance();
                if (step.isFailed()) {
                    throw new UncheckedBlockfrostException(step.error());
                }
                if (step.isEnd()) {
                    return false;
                }
                action.accept(step.items());
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * Items of every page, flattened. The current page is buffered and the next one is fetched only when the
     * buffer has been drained.
     */
    public Stream<T> items() {
        Spliterator<T> spliterator = new Spliterators.AbstractSpliterator<T>(Long.MAX_VALUE, Spliterator.ORDERED) {
            private Iterator<T> buffer = Collections.emptyIterator();

            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                while (!buffer.hasNext()) {
                    ListerStep<T> step = advance();
                    if (step.isFailed()) {
                        throw new UncheckedBlockfrostException(step.error());
                    }
                    if (step.isEnd()) {
                        return false;
                    }
                    buffer = step.items().iterator();
                }
                action.accept(buffer.next());
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    /**
     * @return page number the next advance will request.
     */
    public int currentPage() {
        return currentPage;
    }

    /**
     * @return fixed page size, or {@code null} when the server default is used.
     */
    public Integer pageSize() {
        return pageSize;
    }

    /**
     * @return {@code true} once the sequence ended, cleanly or with an error.
     */
    public boolean isTerminated() {
        State current = state.get();
        return current == State.EXHAUSTED || current == State.FAILED;
    }
}
