package org.apirepository.repository;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Open key/value bag passed to {@link ApiRepository#get(SearchParams)}.
 * <p>
 * Keys are recognised by the concrete data source, not by the repository engine;
 * each implementation documents the keys it understands.
 * </p>
 */
public final class SearchParams {

    private final Map<String, Object> values = new LinkedHashMap<>();

    public SearchParams() {
    }

    public SearchParams(Map<String, ?> values) {
        if (values != null) {
            this.values.putAll(values);
        }
    }

    public static SearchParams of(String key, Object value) {
        return new SearchParams().with(key, value);
    }

    /**
     * Adds or replaces a parameter.
     *
     * @return this instance for chaining
     */
    public SearchParams with(String key, Object value) {
        values.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Unmodifiable view of the parameters, in insertion order. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchParams)) return false;
        return values.equals(((SearchParams) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SearchParams" + values;
    }
}
