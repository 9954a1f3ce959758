package org.apirepository.iterator;

import java.util.List;

/**
 * Callback used by {@link PagedApiIterator} to retrieve the next page from the remote source.
 *
 * @param <T> record type
 */
@FunctionalInterface
public interface PageFetcher<T> {

    /**
     * Fetches one page of records.
     *
     * @param offset   number of records already received before this page
     * @param pageSize number of records requested
     * @return the records of the page; an empty list when no further data is available
     */
    List<T> fetch(int offset, int pageSize);
}
