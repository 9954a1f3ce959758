package org.apirepository.iterator;

/**
 * A remote data source able to open a fresh {@link ApiIterator} over its records.
 *
 * @param <T> record type
 */
@FunctionalInterface
public interface ApiIterable<T> {

    /**
     * Opens an iterator positioned on the first record (if any).
     *
     * @return a new iterator, or {@code null} if the data source cannot supply one
     */
    ApiIterator<T> getIterator();
}
