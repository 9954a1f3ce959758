package org.apirepository.calcite;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Column of a repository table: SQL name, type, and JSON path of the value within a record.
 */
@Getter
@AllArgsConstructor
public class Field {

    /** SQL column name */
    private final String name;
    /** Column type */
    private final RestFieldType restFieldType;
    /** JSON path of the value within the record */
    private final String jsonpath;

    /**
     * Column whose JSON path equals its name.
     */
    public Field(String name, RestFieldType restFieldType) {
        this(name, restFieldType, name);
    }
}
