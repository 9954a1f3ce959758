package org.apirepository.rest;

import org.apirepository.iterator.ApiIterable;
import org.apirepository.iterator.ApiIterator;
import org.apirepository.iterator.PagedApiIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.IntSupplier;

/**
 * REST data source: every {@link #getIterator()} call starts a new traversal from offset 0.
 * <p>
 * The first page is fetched eagerly, so the returned iterator is already positioned on the first record.
 * </p>
 */
public class RestApiIterable<T> implements ApiIterable<T> {

    private static final Logger logger = LoggerFactory.getLogger(RestApiIterable.class);

    private final RestPageFetcher<T> pageFetcher;
    private final IntSupplier pageSize;

    /**
     * @param pageFetcher fetcher for the endpoint
     * @param pageSize    page size used for the first page of each traversal
     */
    public RestApiIterable(RestPageFetcher<T> pageFetcher, IntSupplier pageSize) {
        this.pageFetcher = pageFetcher;
        this.pageSize = pageSize;
    }

    @Override
    public ApiIterator<T> getIterator() {
        int firstPageSize = pageSize.getAsInt();
        List<T> firstPage = pageFetcher.fetch(0, firstPageSize);
        logger.debug("Opened traversal with first page of {} records (page size {})", firstPage.size(), firstPageSize);
        return new PagedApiIterator<>(firstPage, firstPageSize, pageFetcher);
    }
}
