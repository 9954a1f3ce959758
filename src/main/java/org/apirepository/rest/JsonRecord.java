package org.apirepository.rest;

import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON object returned by a REST endpoint.
 * <p>
 * Fields are read with relative JSON paths, e.g. {@code id} or {@code address.city}.
 * </p>
 */
public class JsonRecord {

    private final Map<String, Object> fields;

    public JsonRecord(Map<String, Object> fields) {
        this.fields = fields == null ? new LinkedHashMap<>() : new LinkedHashMap<>(fields);
    }

    /**
     * Reads a field value by JSON path.
     *
     * @param path Field name or JSON path; a leading {@code $.} is optional.
     * @return The value found, or {@code null} if not present.
     */
    public Object read(String path) {
        if (fields.isEmpty()) {
            return null;
        }
        try {
            String jsonPath = path.startsWith("$") ? path : "$." + path;
            return JsonPath.read(fields, jsonPath);
        } catch (PathNotFoundException e) {
            return null;
        }
    }

    /** Unmodifiable view of the top-level fields. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    /** Serialises the record back to JSON text. */
    public String toJson() {
        return JSONValue.toJSONString(fields);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JsonRecord)) return false;
        return fields.equals(((JsonRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return toJson();
    }
}
