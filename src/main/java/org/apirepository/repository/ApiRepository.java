package org.apirepository.repository;

import org.apirepository.iterator.ApiIterable;
import org.apirepository.iterator.ApiIterator;
import org.apirepository.repository.event.IterationErrorListener;

import java.util.List;
import java.util.function.Predicate;

/**
 * Collection-like view over a paginated remote data set.
 * <p>
 * There is no save step: {@link #update}, {@link #delete} and {@link #deleteAll} take effect on the
 * remote data source as soon as they return.
 * </p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * ApiRepository<User> users = new UserRepository().attachDataSource(userIterable);
 * users.addIterationErrorListener(e -> log.warn("iteration failed", e.getException()));
 * User bob = users.find(u -> "bob".equals(u.getLogin()));
 * }</pre>
 *
 * @param <T> record type
 */
public interface ApiRepository<T> {

    /**
     * Hard ceiling on the page size the remote API accepts.
     */
    int getMaxPageSize();

    /**
     * Default page size used outside of {@link #find} and {@link #getAll}.
     */
    int getPageSize();

    void setPageSize(int pageSize);

    /**
     * Replaces the data source used by all subsequent calls.
     *
     * @param iterable data source, required
     * @return this repository, for chaining
     * @throws IllegalArgumentException if {@code iterable} is null; the previous data source stays attached
     */
    ApiRepository<T> attachDataSource(ApiIterable<T> iterable);

    /**
     * Attaches a single iterator as the data source. Every call traverses the same cursor from
     * wherever the previous call left it.
     *
     * @param iterator iterator, required
     * @return this repository, for chaining
     * @throws IllegalArgumentException if {@code iterator} is null; the previous data source stays attached
     */
    ApiRepository<T> attach(ApiIterator<T> iterator);

    void addIterationErrorListener(IterationErrorListener listener);

    void removeIterationErrorListener(IterationErrorListener listener);

    /**
     * Returns the first record, in traversal order, that satisfies {@code predicate}.
     * Faults raised during traversal are published to the iteration error listeners instead of thrown.
     *
     * @param predicate match condition, required
     * @return the first match, or {@code null} if none matches, nothing is attached, or the traversal failed
     * @throws IllegalArgumentException if {@code predicate} is null
     */
    T find(Predicate<T> predicate);

    /**
     * Materialises every record of the data source, in traversal order.
     * <p>
     * <b>Warning:</b> cost and memory are unbounded for large or endless data sets.
     * </p>
     *
     * @return all records; an empty list if nothing is attached or the traversal failed
     */
    List<T> getAll();

    /**
     * Looks up a single record with a direct server-side call.
     *
     * @param searchParams lookup parameters understood by the concrete data source, required
     * @return the record, or {@code null} if not found
     * @throws IllegalArgumentException if {@code searchParams} is null
     * @throws org.apirepository.repository.exception.ApiOperationNotSupportedException if the remote API offers no lookup
     */
    T get(SearchParams searchParams);

    void update(T recordToUpdate);

    void delete(T recordToDelete);

    void deleteAll(Predicate<T> predicate);
}
