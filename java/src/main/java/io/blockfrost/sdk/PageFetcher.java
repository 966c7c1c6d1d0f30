package io.blockfrost.sdk;

import java.util.List;

/**
 * Fetches one page of a paged resource. An empty list means there is no more data.
 */
@FunctionalInterface
public interface PageFetcher<T> {

    List<T> fetch(Pagination pagination) throws BlockfrostException;
}
