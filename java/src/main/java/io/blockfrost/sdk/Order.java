package io.blockfrost.sdk;

import java.util.Locale;

/**
 * Ordering of items within paged results; the server default is ascending.
 */
public enum Order {
    ASC,
    DESC;

    public String queryValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
