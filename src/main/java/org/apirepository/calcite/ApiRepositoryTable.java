package org.apirepository.calcite;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.java.JavaTypeFactory;
import org.apache.calcite.jdbc.JavaTypeFactoryImpl;
import org.apache.calcite.linq4j.AbstractEnumerable;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Enumerator;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apirepository.repository.ApiRepositoryBase;
import org.apirepository.rest.RecordMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code ApiRepositoryTable} exposes the records of a repository as a SQL table.
 * <p>
 * Every scan opens a new traversal of the repository's data source and streams it page by page,
 * so a query with {@code LIMIT} stops fetching once enough rows were read.
 * </p>
 */
public class ApiRepositoryTable<T> extends AbstractTable implements ScannableTable {

    private final ApiRepositoryBase<T> repository;
    private final RecordMapper<T> mapper;
    private final List<Field> fields;

    /**
     * @param repository repository whose data source is scanned
     * @param mapper     converts records to JSON for column extraction
     * @param fields     table columns, in order
     */
    public ApiRepositoryTable(ApiRepositoryBase<T> repository, RecordMapper<T> mapper, List<Field> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("At least one column is required");
        }
        this.repository = repository;
        this.mapper = mapper;
        this.fields = new ArrayList<>(fields);
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        JavaTypeFactory javaTypeFactory = typeFactory instanceof JavaTypeFactory
                ? (JavaTypeFactory) typeFactory
                : new JavaTypeFactoryImpl(typeFactory.getTypeSystem());
        RelDataTypeFactory.Builder builder = typeFactory.builder();
        for (Field field : fields) {
            builder.add(field.getName(), field.getRestFieldType().toType(javaTypeFactory));
        }
        return builder.build();
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        return new AbstractEnumerable<>() {
            public Enumerator<Object[]> enumerator() {
                return new ApiRepositoryEnumerator<>(repository.getDataSource(), mapper, fields, repository.getMaxPageSize());
            }
        };
    }

    public List<Field> getFields() {
        return new ArrayList<>(fields);
    }
}
