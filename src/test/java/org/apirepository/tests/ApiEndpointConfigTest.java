package org.apirepository.tests;

import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.model.ApiHeader;
import org.apirepository.rest.RestEndpointClient;
import org.apirepository.rest.config.MapConfiguration;
import org.apirepository.rest.config.SystemPropertyConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reading endpoint descriptions from configuration sources.
 */
public class ApiEndpointConfigTest {

    @Test
    @DisplayName("Defaults apply to every key that is not configured")
    public void testDefaults() {
        Map<String, String> values = new HashMap<>();
        values.put("users.addresses", "http://localhost:8080");

        ApiEndpointConfig config = ApiEndpointConfig.fromConfiguration(new MapConfiguration(values), "users");

        assertEquals("http://localhost:8080", config.getAddresses());
        assertEquals("GET", config.getMethod());
        assertEquals("", config.getUrlTemplate());
        assertEquals(0, config.getPageStart());
        assertEquals(20, config.getPageSize());
        assertEquals(100, config.getMaxPageSize());
        assertEquals("$", config.getItemsPath());
        assertEquals(30, config.getConnectionTimeout());
        assertEquals(30, config.getResponseTimeout());
        assertEquals("PUT", config.getUpdateMethod());
        assertNull(config.getItemUrlTemplate());
        assertNull(config.getDeleteUrlTemplate());
        assertTrue(config.getApiHeaders().isEmpty());
    }

    @Test
    @DisplayName("All properties and headers are read from a Properties source")
    public void testFullConfiguration() {
        Properties properties = new Properties();
        properties.setProperty("crm.contacts.addresses", "https://a.example.com,https://b.example.com");
        properties.setProperty("crm.contacts.method", "POST");
        properties.setProperty("crm.contacts.urlTemplate", "/contacts/search");
        properties.setProperty("crm.contacts.bodyTemplate", "{\"page\": ${page}, \"size\": ${limit}}");
        properties.setProperty("crm.contacts.pageStart", "1");
        properties.setProperty("crm.contacts.pageSize", "50");
        properties.setProperty("crm.contacts.maxPageSize", " 500 ");
        properties.setProperty("crm.contacts.itemsPath", "$.result.items");
        properties.setProperty("crm.contacts.itemUrlTemplate", "/contacts/${id}");
        properties.setProperty("crm.contacts.updateUrlTemplate", "/contacts/${record.id}");
        properties.setProperty("crm.contacts.updateMethod", "PATCH");
        properties.setProperty("crm.contacts.deleteUrlTemplate", "/contacts/${record.id}");
        properties.setProperty("crm.contacts.responseTimeout", "5");
        properties.setProperty("crm.contacts.headers", "Authorization: Bearer ${token}; X-Client: api-repository");

        ApiEndpointConfig config = ApiEndpointConfig.fromConfiguration(new MapConfiguration(properties), "crm.contacts");

        assertEquals("POST", config.getMethod());
        assertEquals(1, config.getPageStart());
        assertEquals(50, config.getPageSize());
        assertEquals(500, config.getMaxPageSize());
        assertEquals("$.result.items", config.getItemsPath());
        assertEquals("PATCH", config.getUpdateMethod());
        assertEquals(5, config.getResponseTimeout());
        assertEquals(List.of(new ApiHeader("Authorization", "Bearer ${token}"), new ApiHeader("X-Client", "api-repository")),
                config.getApiHeaders());
    }

    @Test
    @DisplayName("Missing addresses and malformed numbers are rejected")
    public void testInvalidConfiguration() {
        MapConfiguration empty = new MapConfiguration(new HashMap<>());
        assertThrows(IllegalArgumentException.class, () -> ApiEndpointConfig.fromConfiguration(empty, "users"));

        Map<String, String> values = new HashMap<>();
        values.put("users.addresses", "http://localhost:8080");
        values.put("users.pageSize", "twenty");
        MapConfiguration malformed = new MapConfiguration(values);
        assertThrows(IllegalArgumentException.class, () -> ApiEndpointConfig.fromConfiguration(malformed, "users"));
    }

    @Test
    @DisplayName("System properties are a configuration source")
    public void testSystemPropertyConfiguration() {
        System.setProperty("apirepository.test.addresses", "http://localhost:9090");
        try {
            SystemPropertyConfiguration configuration = new SystemPropertyConfiguration();
            assertTrue(configuration.has("apirepository.test.addresses"));
            assertEquals("http://localhost:9090",
                    ApiEndpointConfig.fromConfiguration(configuration, "apirepository.test").getAddresses());
        } finally {
            System.clearProperty("apirepository.test.addresses");
        }
    }

    @Test
    @DisplayName("A client needs at least one address")
    public void testClientRequiresAddress() {
        ApiEndpointConfig config = new ApiEndpointConfig();
        assertThrows(IllegalArgumentException.class, () -> new RestEndpointClient(config));
        config.setAddresses(" ");
        assertThrows(IllegalArgumentException.class, () -> new RestEndpointClient(config));
        assertThrows(IllegalArgumentException.class, () -> new RestEndpointClient(null));
    }
}
