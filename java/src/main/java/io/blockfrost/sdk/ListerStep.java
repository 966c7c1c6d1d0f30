package io.blockfrost.sdk;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link Lister#advance()} call: a page of items, the end of the sequence, or the terminal error.
 */
public final class ListerStep<T> {

    public enum Kind {
        PAGE,
        END,
        FAILED
    }

    private final Kind kind;
    private final int pageNumber;
    private final List<T> items;
    private final BlockfrostException error;

    private ListerStep(Kind kind, int pageNumber, List<T> items, BlockfrostException error) {
        this.kind = kind;
        this.pageNumber = pageNumber;
        this.items = items;
        this.error = error;
    }

    static <T> ListerStep<T> page(int pageNumber, List<T> items) {
        return new ListerStep<>(Kind.PAGE, pageNumber, Objects.requireNonNull(items, "items"), null);
    }

    static <T> ListerStep<T> end() {
        return new ListerStep<>(Kind.END, 0, List.of(), null);
    }

    static <T> ListerStep<T> failed(int pageNumber, BlockfrostException error) {
        return new ListerStep<>(Kind.FAILED, pageNumber, List.of(), Objects.requireNonNull(error, "error"));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isPage() {
        return kind == Kind.PAGE;
    }

    public boolean isEnd() {
        return kind == Kind.END;
    }

    public boolean isFailed() {
        return kind == Kind.FAILED;
    }

    /**
     * @return page number that produced this step; {@code 0} for {@link Kind#END}.
     */
    public int pageNumber() {
        return pageNumber;
    }

    /**
     * @return items of the page; empty unless this is a {@link Kind#PAGE} step.
     */
    public List<T> items() {
        return items;
    }

    /**
     * @return the terminal error, or {@code null} unless this is a {@link Kind#FAILED} step.
     */
    public BlockfrostException error() {
        return error;
    }

    @Override
    public String toString() {
        switch (kind) {
            case PAGE:
                return "ListerStep[PAGE " + pageNumber + ", " + items.size() + " items]";
            case FAILED:
                return "ListerStep[FAILED " + pageNumber + ", " + error.getClass().getSimpleName() + "]";
            default:
                return "ListerStep[END]";
        }
    }
}
