package org.apirepository.rest;

/**
 * Converts between the JSON records of a REST endpoint and the caller's record type.
 *
 * @param <T> record type exposed by the repository
 */
public interface RecordMapper<T> {

    T fromJson(JsonRecord json);

    JsonRecord toJson(T record);
}
