package org.apirepository.calcite;

import org.apache.calcite.linq4j.Enumerator;
import org.apirepository.iterator.ApiIterable;
import org.apirepository.iterator.ApiIterator;
import org.apirepository.rest.JsonRecord;
import org.apirepository.rest.RecordMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Enumerator streaming the records of a repository data source as SQL rows.
 * <p>
 * Calcite calls {@code moveNext()} before the first {@code current()}, while an {@link ApiIterator}
 * is already positioned on its first record; the first {@code moveNext()} therefore only checks that
 * a record is there.
 * </p>
 *
 * - Pages are fetched with the repository's maximum page size; the prior size is restored on close.
 * - Faults of the data source propagate to the SQL statement.
 */
public class ApiRepositoryEnumerator<T> implements Enumerator<Object[]> {

    private static final Logger logger = LoggerFactory.getLogger(ApiRepositoryEnumerator.class);

    private final ApiIterable<T> dataSource;
    private final RecordMapper<T> mapper;
    private final List<Field> fields;
    private final int maxPageSize;

    private ApiIterator<T> iterator;
    private int priorPageSize;
    /** True once the first moveNext() was answered */
    private boolean started;
    /** Record under the cursor */
    private T current;

    /**
     * @param dataSource  data source to stream, may be null (empty table)
     * @param mapper      converts records to JSON for column extraction
     * @param fields      projected columns, in row order
     * @param maxPageSize page size used while streaming; ignored if below 1
     */
    public ApiRepositoryEnumerator(ApiIterable<T> dataSource, RecordMapper<T> mapper, List<Field> fields, int maxPageSize) {
        this.dataSource = dataSource;
        this.mapper = mapper;
        this.fields = fields;
        this.maxPageSize = maxPageSize;
        open();
    }

    @Override
    public Object[] current() {
        JsonRecord json = mapper.toJson(current);
        Object[] row = new Object[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            row[i] = ValueConverter.convert(json.read(field.getJsonpath()), field.getRestFieldType());
        }
        return row;
    }

    @Override
    public boolean moveNext() {
        if (iterator == null) {
            return false;
        }
        if (!started) {
            started = true;
            current = iterator.current();
            return current != null;
        }
        if (current == null || !iterator.moveNext()) {
            current = null;
            return false;
        }
        current = iterator.current();
        return current != null;
    }

    /**
     * Starts over with a fresh traversal of the data source.
     */
    @Override
    public void reset() {
        restorePageSize();
        open();
    }

    @Override
    public void close() {
        restorePageSize();
        iterator = null;
        current = null;
    }

    private void open() {
        started = false;
        current = null;
        iterator = dataSource == null ? null : dataSource.getIterator();
        if (iterator != null) {
            priorPageSize = iterator.getPageSize();
            if (maxPageSize >= 1) {
                iterator.setPageSize(maxPageSize);
            }
            logger.debug("Streaming data source with page size {}", iterator.getPageSize());
        }
    }

    private void restorePageSize() {
        if (iterator != null) {
            iterator.setPageSize(priorPageSize);
        }
    }
}
