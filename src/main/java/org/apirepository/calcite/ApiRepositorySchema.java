package org.apirepository.calcite;

import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema grouping repository tables under one name, e.g. {@code SELECT * FROM api.users}.
 */
public class ApiRepositorySchema extends AbstractSchema {

    private final Map<String, Table> tables = new LinkedHashMap<>();

    /**
     * Registers a table; a table of the same name is replaced.
     *
     * @return this schema for chaining
     */
    public ApiRepositorySchema addTable(String name, ApiRepositoryTable<?> table) {
        tables.put(name, table);
        return this;
    }

    @Override
    protected Map<String, Table> getTableMap() {
        return tables;
    }
}
