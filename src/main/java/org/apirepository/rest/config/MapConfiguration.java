package org.apirepository.rest.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration backed by an in-memory map, e.g. loaded from a properties file.
 */
public class MapConfiguration implements AdapterConfiguration {

    private final Map<String, String> values;

    public MapConfiguration(Map<String, String> values) {
        this.values = values == null ? new HashMap<>() : new HashMap<>(values);
    }

    public MapConfiguration(Properties properties) {
        this.values = new HashMap<>();
        if (properties != null) {
            for (String name : properties.stringPropertyNames()) {
                values.put(name, properties.getProperty(name));
            }
        }
    }

    @Override
    public String get(String key) {
        return values.get(key);
    }
}
