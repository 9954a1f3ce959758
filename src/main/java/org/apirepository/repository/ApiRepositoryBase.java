package org.apirepository.repository;

import org.apirepository.iterator.ApiIterable;
import org.apirepository.iterator.ApiIterator;
import org.apirepository.iterator.exception.IteratorException;
import org.apirepository.repository.event.IterationErrorEvent;
import org.apirepository.repository.event.IterationErrorListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Repository engine shared by all concrete data sources.
 * <p>
 * Implements {@link #find} and {@link #getAll} on top of the attached {@link ApiIterable}:
 * </p>
 * <ul>
 *   <li>{@code find} drops the iterator's page size to 1, since only the first match matters.</li>
 *   <li>{@code getAll} raises it to {@link #getMaxPageSize()}, to keep the number of requests low.</li>
 *   <li>Both put the prior page size back before returning, whatever the outcome.</li>
 *   <li>A fault during traversal is published as an {@link IterationErrorEvent}; the call then
 *       returns {@code null} or an empty list, never a partial result.</li>
 * </ul>
 *
 * Lookup and mutations are left to subclasses. Page-size bracketing is not synchronized:
 * at most one traversal per attached iterator may be in flight.
 *
 * @param <T> record type
 */
public abstract class ApiRepositoryBase<T> implements ApiRepository<T> {

    private static final Logger logger = LoggerFactory.getLogger(ApiRepositoryBase.class);

    /** Active data source; null until attached */
    private ApiIterable<T> iterable;

    private final List<IterationErrorListener> iterationErrorListeners = new CopyOnWriteArrayList<>();

    protected ApiRepositoryBase() {
    }

    @Override
    public ApiRepository<T> attachDataSource(ApiIterable<T> iterable) {
        if (iterable == null) {
            throw new IllegalArgumentException("iterable must not be null");
        }
        this.iterable = iterable;
        return this;
    }

    @Override
    public ApiRepository<T> attach(ApiIterator<T> iterator) {
        if (iterator == null) {
            throw new IllegalArgumentException("iterator must not be null");
        }
        return attachDataSource(() -> iterator);
    }

    /**
     * Returns the attached data source, or {@code null} if none was attached.
     */
    public ApiIterable<T> getDataSource() {
        return iterable;
    }

    @Override
    public void addIterationErrorListener(IterationErrorListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        iterationErrorListeners.add(listener);
    }

    @Override
    public void removeIterationErrorListener(IterationErrorListener listener) {
        iterationErrorListeners.remove(listener);
    }

    @Override
    public T find(Predicate<T> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate must not be null");
        }

        ApiIterator<T> iterator;
        try {
            iterator = openIterator();
        } catch (RuntimeException e) {
            publishIterationError("find", e);
            return null;
        }
        if (iterator == null) {
            return null;
        }

        int priorPageSize = iterator.getPageSize();
        if (getMaxPageSize() >= 1) {
            iterator.setPageSize(1);
        }

        T result = null;
        try {
            // greedy cursor: read current before moving
            T current;
            do {
                current = iterator.current();
                if (current != null && predicate.test(current)) {
                    result = current;
                    break;
                }
            } while (current != null && iterator.moveNext());
        } catch (RuntimeException e) {
            publishIterationError("find", e);
            result = null;
        } finally {
            iterator.setPageSize(priorPageSize);
        }

        return result;
    }

    @Override
    public List<T> getAll() {
        try {
            return collectAll();
        } catch (RuntimeException e) {
            publishIterationError("getAll", e);
            return new ArrayList<>();
        }
    }

    /**
     * Reads the whole data source with the page size forced to {@link #getMaxPageSize()},
     * like {@link #getAll()}, but lets traversal faults propagate.
     * Used by mutations that pick their targets from the data source.
     *
     * @return every record in traversal order; empty if no data source is attached
     */
    protected List<T> collectAll() {
        ApiIterator<T> iterator = openIterator();
        if (iterator == null) {
            return new ArrayList<>();
        }

        int priorPageSize = iterator.getPageSize();
        if (getMaxPageSize() >= 1) {
            iterator.setPageSize(getMaxPageSize());
        }

        List<T> result = new ArrayList<>();
        try {
            T current;
            do {
                current = iterator.current();
                if (current == null) {
                    break;
                }
                result.add(current);
            } while (iterator.moveNext());
        } finally {
            iterator.setPageSize(priorPageSize);
        }
        logger.debug("Retrieved {} records", result.size());
        return result;
    }

    /**
     * Fallback for data sources without a server-side lookup: searches with {@link #find}
     * using a predicate derived from the search parameters.
     *
     * @param searchParams     lookup parameters, required
     * @param predicateFactory turns the parameters into a match condition
     * @return the first match, or {@code null}
     */
    protected T findBySearchParams(SearchParams searchParams, Function<SearchParams, Predicate<T>> predicateFactory) {
        if (searchParams == null) {
            throw new IllegalArgumentException("searchParams must not be null");
        }
        return find(predicateFactory.apply(searchParams));
    }

    /**
     * Publishes an iteration error to every registered listener, in registration order.
     */
    protected void onIterationError(IterationErrorEvent event) {
        for (IterationErrorListener listener : iterationErrorListeners) {
            listener.onIterationError(event);
        }
    }

    /**
     * Registered listeners, in registration order.
     */
    protected List<IterationErrorListener> getIterationErrorListeners() {
        return Collections.unmodifiableList(iterationErrorListeners);
    }

    private void publishIterationError(String operation, RuntimeException cause) {
        logger.warn("Iteration failed during {}: {}", operation, cause.getMessage());
        onIterationError(new IterationErrorEvent(this, IteratorException.buildIteratorException(cause)));
    }

    private ApiIterator<T> openIterator() {
        return iterable == null ? null : iterable.getIterator();
    }
}
