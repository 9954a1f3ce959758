package org.apirepository.rest.json;

import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import org.apirepository.rest.JsonRecord;
import org.apirepository.rest.exception.ApiRequestException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the records of one page from a JSON response.
 *
 * <p><b>JSON format example</b> (items path {@code $.data}):</p>
 * <pre>
 * {
 *   "total": 42,
 *   "data": [
 *     {"id": 1, "name": "Alice"},
 *     {"id": 2, "name": "Bob"}
 *   ]
 * }
 * </pre>
 *
 * - A single object at the items path is read as a one-record page.
 * - A missing path or a blank body is an empty page.
 * - Array elements that are not objects are exposed under {@code item_value}.
 */
public class JsonPageReader {

    private final String itemsPath;

    public JsonPageReader(String itemsPath) {
        this.itemsPath = itemsPath == null || itemsPath.isBlank() ? "$" : itemsPath;
    }

    /**
     * @param json response body
     * @return the records of the page, in response order
     * @throws ApiRequestException if the body is not valid JSON
     */
    public List<JsonRecord> read(String json) {
        List<JsonRecord> result = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return result;
        }
        Object items;
        try {
            items = JsonPath.read(json, itemsPath);
        } catch (PathNotFoundException e) {
            return result;
        } catch (InvalidJsonException e) {
            throw ApiRequestException.buildApiRequestException("Failed to parse JSON response", e);
        }

        if (items instanceof List) {
            for (Object item : (List<?>) items) {
                result.add(toRecord(item));
            }
        } else if (items != null) {
            result.add(toRecord(items));
        }
        return result;
    }

    /**
     * Reads a response holding exactly one JSON object.
     *
     * @param json response body
     * @return the record, or {@code null} for a blank body
     * @throws ApiRequestException if the body is not valid JSON
     */
    public static JsonRecord readSingle(String json) {
        List<JsonRecord> records = new JsonPageReader("$").read(json);
        return records.isEmpty() ? null : records.get(0);
    }

    @SuppressWarnings("unchecked")
    private JsonRecord toRecord(Object item) {
        if (item instanceof Map) {
            return new JsonRecord((Map<String, Object>) item);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("item_value", item);
        return new JsonRecord(wrapped);
    }
}
