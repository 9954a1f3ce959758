package org.apirepository.iterator;

/**
 * Greedy cursor over a paginated, potentially unbounded remote data set.
 * <p>
 * A REST API cannot answer "is there more?" without fetching, so the contract
 * exposes no {@code hasNext}. Traversal always reads {@link #current()} first and
 * only then attempts {@link #moveNext()}:
 * </p>
 * <pre>{@code
 * T item;
 * do {
 *     item = iterator.current();
 *     ...
 * } while (item != null && iterator.moveNext());
 * }</pre>
 *
 * @param <T> record type produced by the remote data source
 */
public interface ApiIterator<T> {

    /**
     * Returns the element at the cursor position. Never fetches.
     *
     * @return the current element, or {@code null} if the cursor is not positioned on a valid element
     */
    T current();

    /**
     * Moves the cursor to the next element, fetching the next remote page when the
     * buffered page is exhausted.
     *
     * @return {@code true} if a valid element is now positioned under the cursor
     * @throws RuntimeException on network, decoding or rate-limit faults
     */
    boolean moveNext();

    /**
     * Number of elements requested per underlying fetch.
     */
    int getPageSize();

    /**
     * Changes the number of elements requested per fetch. Permitted mid-traversal;
     * takes effect on the next fetch.
     *
     * @param pageSize new page size
     */
    void setPageSize(int pageSize);
}
