package org.apirepository.calcite;

import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;
import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.rest.JsonRecord;
import org.apirepository.rest.JsonRecordMapper;
import org.apirepository.rest.RestApiRepository;
import org.apirepository.rest.config.AdapterConfiguration;
import org.apirepository.rest.config.MapConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link ApiRepositorySchema} of REST tables from a Calcite model operand.
 *
 * <p><b>Operand keys:</b></p>
 * <ul>
 *   <li>{@code tables}: comma separated table names</li>
 *   <li>{@code <table>.<property>}: endpoint properties, as read by
 *       {@link ApiEndpointConfig#fromConfiguration(AdapterConfiguration, String)}</li>
 *   <li>{@code <table>.columns}: comma separated {@code name:type[:jsonpath]} column definitions</li>
 * </ul>
 *
 * <p><b>Example model:</b></p>
 * <pre>
 * {
 *   "name": "api", "type": "custom",
 *   "factory": "org.apirepository.calcite.ApiRepositorySchemaFactory",
 *   "operand": {
 *     "tables": "users",
 *     "users.addresses": "https://api.example.com",
 *     "users.urlTemplate": "/users?offset=${offset}&amp;limit=${limit}",
 *     "users.itemsPath": "$.data",
 *     "users.columns": "id:int,login:string,city:string:address.city"
 *   }
 * }
 * </pre>
 */
public class ApiRepositorySchemaFactory implements SchemaFactory {

    private static final Logger logger = LoggerFactory.getLogger(ApiRepositorySchemaFactory.class);

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Map<String, String> values = new HashMap<>();
        if (operand != null) {
            for (Map.Entry<String, Object> entry : operand.entrySet()) {
                if (entry.getValue() != null) {
                    values.put(entry.getKey(), entry.getValue().toString());
                }
            }
        }
        AdapterConfiguration configuration = new MapConfiguration(values);

        ApiRepositorySchema schema = new ApiRepositorySchema();
        String tables = configuration.get("tables", "");
        for (String tableName : tables.split(",")) {
            String trimmed = tableName.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            ApiEndpointConfig config = ApiEndpointConfig.fromConfiguration(configuration, trimmed);
            RestApiRepository<JsonRecord> repository = RestApiRepository.create(config, JsonRecordMapper.INSTANCE);
            List<Field> fields = parseColumns(trimmed, configuration.get(trimmed + ".columns"));
            schema.addTable(trimmed, new ApiRepositoryTable<>(repository, JsonRecordMapper.INSTANCE, fields));
            logger.info("Registered REST table '{}' in schema '{}' with {} columns", trimmed, name, fields.size());
        }
        return schema;
    }

    /**
     * Parses {@code name:type[:jsonpath]} column definitions.
     *
     * @throws IllegalArgumentException if the definitions are missing or malformed
     */
    static List<Field> parseColumns(String tableName, String columns) {
        if (columns == null || columns.isBlank()) {
            throw new IllegalArgumentException("Missing configuration key: " + tableName + ".columns");
        }
        List<Field> fields = new ArrayList<>();
        for (String column : columns.split(",")) {
            String[] parts = column.trim().split(":", 3);
            if (parts.length < 2) {
                throw new IllegalArgumentException("Column definition must be name:type[:jsonpath]: " + column);
            }
            RestFieldType type = RestFieldType.of(parts[1]);
            if (type == null) {
                throw new IllegalArgumentException("Unknown column type '" + parts[1] + "' in " + tableName + ".columns");
            }
            String jsonpath = parts.length == 3 ? parts[2].trim() : parts[0].trim();
            fields.add(new Field(parts[0].trim(), type, jsonpath));
        }
        return fields;
    }
}
