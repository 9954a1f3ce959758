package org.apirepository.tests.base;

import org.apirepository.repository.ApiRepositoryBase;
import org.apirepository.repository.SearchParams;
import org.apirepository.repository.exception.ApiOperationNotSupportedException;

import java.util.function.Predicate;

/**
 * Read-only repository over whatever data source is attached; lookups fall back to find.
 */
public class InMemoryApiRepository<T> extends ApiRepositoryBase<T> {

    private final int maxPageSize;
    private int pageSize = 10;

    public InMemoryApiRepository(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    @Override
    public int getMaxPageSize() {
        return maxPageSize;
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public T get(SearchParams searchParams) {
        return findBySearchParams(searchParams, params -> record -> record.equals(params.get("value")));
    }

    @Override
    public void update(T recordToUpdate) {
        throw ApiOperationNotSupportedException.buildApiOperationNotSupportedException("update", "in-memory");
    }

    @Override
    public void delete(T recordToDelete) {
        throw ApiOperationNotSupportedException.buildApiOperationNotSupportedException("delete", "in-memory");
    }

    @Override
    public void deleteAll(Predicate<T> predicate) {
        throw ApiOperationNotSupportedException.buildApiOperationNotSupportedException("deleteAll", "in-memory");
    }
}
