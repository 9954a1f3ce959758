package org.apirepository.rest;

/**
 * Identity mapping, for repositories that expose the raw {@link JsonRecord}s.
 */
public class JsonRecordMapper implements RecordMapper<JsonRecord> {

    public static final JsonRecordMapper INSTANCE = new JsonRecordMapper();

    @Override
    public JsonRecord fromJson(JsonRecord json) {
        return json;
    }

    @Override
    public JsonRecord toJson(JsonRecord record) {
        return record;
    }
}
