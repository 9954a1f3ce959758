package org.apirepository.rest.config;

/**
 * Configuration source for REST data sources.
 *
 * <p>Abstracts configuration sources (system properties, property files, maps)
 * to enable testability and flexibility.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * AdapterConfiguration config = new SystemPropertyConfiguration();
 * ApiEndpointConfig users = ApiEndpointConfig.fromConfiguration(config, "apirepository.users");
 * }</pre>
 */
public interface AdapterConfiguration {

    /**
     * Gets configuration value by key.
     *
     * @param key Configuration key
     * @return Configuration value or null if not found
     */
    String get(String key);

    /**
     * Gets configuration value by key with default fallback.
     *
     * @param key Configuration key
     * @param defaultValue Default value if key not found
     * @return Configuration value or default value
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Gets an integer value by key.
     *
     * @param key Configuration key
     * @param defaultValue Value used if the key is missing or blank
     * @return Parsed value or default value
     * @throws IllegalArgumentException if the value is not an integer
     */
    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' is not an integer: " + value, e);
        }
    }

    /**
     * Checks if configuration key exists.
     *
     * @param key Configuration key
     * @return true if key exists, false otherwise
     */
    default boolean has(String key) {
        return get(key) != null;
    }
}
