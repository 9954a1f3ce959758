package org.apirepository.rest.config;

/**
 * Configuration implementation that reads from Java system properties.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * System.setProperty("apirepository.users.addresses", "https://api.example.com");
 * AdapterConfiguration config = new SystemPropertyConfiguration();
 * String addresses = config.get("apirepository.users.addresses");
 * }</pre>
 */
public class SystemPropertyConfiguration implements AdapterConfiguration {

    @Override
    public String get(String key) {
        return System.getProperty(key);
    }
}
