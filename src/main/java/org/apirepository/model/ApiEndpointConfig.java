package org.apirepository.model;

import lombok.Data;
import org.apirepository.rest.config.AdapterConfiguration;

import java.util.ArrayList;
import java.util.List;

/**
 * Describes one paginated REST endpoint used as a repository data source.
 * <p>
 * All URL and body values are FreeMarker templates rendered against the paging variables
 * ({@code offset}, {@code limit}, {@code page}, {@code pageStart}) and, for single-record calls,
 * the search parameters or the record itself (under {@code record}).
 * </p>
 */
@Data
public class ApiEndpointConfig {

    public static final String DEFAULT_METHOD = "GET";
    public static final String DEFAULT_UPDATE_METHOD = "PUT";
    public static final String DEFAULT_ITEMS_PATH = "$";
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int DEFAULT_MAX_PAGE_SIZE = 100;
    public static final int DEFAULT_TIMEOUT = 30;

    /** Comma separated base URLs, tried in order until one answers. */
    private String addresses;
    private int connectionTimeout = DEFAULT_TIMEOUT;
    private int responseTimeout = DEFAULT_TIMEOUT;

    private String method = DEFAULT_METHOD;
    private String urlTemplate;
    private String bodyTemplate;
    private List<ApiHeader> apiHeaders = new ArrayList<>();

    /** Number of the first page, for APIs paging by page number rather than offset. */
    private int pageStart;
    private int pageSize = DEFAULT_PAGE_SIZE;
    private int maxPageSize = DEFAULT_MAX_PAGE_SIZE;
    /** JsonPath of the record array within a page response. */
    private String itemsPath = DEFAULT_ITEMS_PATH;

    /** Direct single-record lookup; absent if the API has none. */
    private String itemUrlTemplate;
    private String updateUrlTemplate;
    private String updateMethod = DEFAULT_UPDATE_METHOD;
    private String updateBodyTemplate;
    private String deleteUrlTemplate;

    /**
     * Reads an endpoint description from configuration keys {@code <prefix>.<property>}.
     * <p>
     * Headers are read from {@code <prefix>.headers} as {@code Name: value} pairs separated by {@code ;}.
     * </p>
     *
     * @param configuration configuration source
     * @param prefix        key prefix, e.g. {@code apirepository.users}
     * @return the populated configuration
     * @throws IllegalArgumentException if {@code <prefix>.addresses} is missing
     */
    public static ApiEndpointConfig fromConfiguration(AdapterConfiguration configuration, String prefix) {
        String addresses = configuration.get(prefix + ".addresses");
        if (addresses == null || addresses.isBlank()) {
            throw new IllegalArgumentException("Missing configuration key: " + prefix + ".addresses");
        }

        ApiEndpointConfig config = new ApiEndpointConfig();
        config.setAddresses(addresses);
        config.setConnectionTimeout(configuration.getInt(prefix + ".connectionTimeout", DEFAULT_TIMEOUT));
        config.setResponseTimeout(configuration.getInt(prefix + ".responseTimeout", DEFAULT_TIMEOUT));
        config.setMethod(configuration.get(prefix + ".method", DEFAULT_METHOD));
        config.setUrlTemplate(configuration.get(prefix + ".urlTemplate", ""));
        config.setBodyTemplate(configuration.get(prefix + ".bodyTemplate"));
        config.setPageStart(configuration.getInt(prefix + ".pageStart", 0));
        config.setPageSize(configuration.getInt(prefix + ".pageSize", DEFAULT_PAGE_SIZE));
        config.setMaxPageSize(configuration.getInt(prefix + ".maxPageSize", DEFAULT_MAX_PAGE_SIZE));
        config.setItemsPath(configuration.get(prefix + ".itemsPath", DEFAULT_ITEMS_PATH));
        config.setItemUrlTemplate(configuration.get(prefix + ".itemUrlTemplate"));
        config.setUpdateUrlTemplate(configuration.get(prefix + ".updateUrlTemplate"));
        config.setUpdateMethod(configuration.get(prefix + ".updateMethod", DEFAULT_UPDATE_METHOD));
        config.setUpdateBodyTemplate(configuration.get(prefix + ".updateBodyTemplate"));
        config.setDeleteUrlTemplate(configuration.get(prefix + ".deleteUrlTemplate"));
        config.setApiHeaders(parseHeaders(configuration.get(prefix + ".headers")));
        return config;
    }

    private static List<ApiHeader> parseHeaders(String headers) {
        List<ApiHeader> result = new ArrayList<>();
        if (headers == null) {
            return result;
        }
        for (String pair : headers.split(";")) {
            int colonIndex = pair.indexOf(':');
            if (colonIndex > 0) {
                String name = pair.substring(0, colonIndex).trim();
                String value = pair.substring(colonIndex + 1).trim();
                if (!name.isEmpty()) {
                    result.add(new ApiHeader(name, value));
                }
            }
        }
        return result;
    }
}
