package org.apirepository.rest;

import com.google.common.base.Joiner;
import freemarker.template.TemplateModel;
import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.rest.exception.ApiRequestException;
import org.apirepository.rest.service.HttpRequestBuilder;
import org.apirepository.rest.service.HttpRequestExecutor;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Sends templated requests to one REST endpoint, with failover across its configured addresses.
 * <p>
 * Addresses are tried in order until one answers. The first address that answered is reused
 * for all later requests, so the pages of one traversal come from the same server.
 * </p>
 */
public class RestEndpointClient {

    private static final Logger logger = LoggerFactory.getLogger(RestEndpointClient.class);

    private final ApiEndpointConfig config;
    private final HttpRequestBuilder httpRequestBuilder;
    private final HttpRequestExecutor httpRequestExecutor;

    /** Address that answered last; null until the first successful request. */
    private volatile String activeAddress;

    public RestEndpointClient(ApiEndpointConfig config) {
        this(config, new HttpRequestBuilder(), new HttpRequestExecutor());
    }

    public RestEndpointClient(ApiEndpointConfig config,
                              HttpRequestBuilder httpRequestBuilder,
                              HttpRequestExecutor httpRequestExecutor) {
        if (config == null || config.getAddresses() == null || config.getAddresses().isBlank()) {
            throw new IllegalArgumentException("Endpoint configuration with at least one address is required");
        }
        this.config = config;
        this.httpRequestBuilder = httpRequestBuilder;
        this.httpRequestExecutor = httpRequestExecutor;
    }

    /**
     * Renders and sends one request.
     *
     * @param method       HTTP method
     * @param urlTemplate  path template appended to the address
     * @param bodyTemplate body template, or null
     * @param context      template variables
     * @return response body, empty if the response had none
     * @throws ApiRequestException if the status is unsuccessful or no address could be reached
     */
    public String send(String method, String urlTemplate, String bodyTemplate, Map<String, TemplateModel> context) {
        String address = activeAddress;
        if (address != null) {
            try {
                return doRequest(address, method, urlTemplate, bodyTemplate, context);
            } catch (IOException e) {
                throw ApiRequestException.buildApiRequestException("Request to " + address + " failed: " + e.getMessage(), e);
            }
        }

        List<String> errors = new ArrayList<>();
        for (String tryingAddress : config.getAddresses().split(",")) {
            String trimmed = tryingAddress.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                String response = doRequest(trimmed, method, urlTemplate, bodyTemplate, context);
                activeAddress = trimmed;
                return response;
            } catch (IOException e) {
                errors.add(trimmed + ": " + e.getMessage());
                logger.warn("Request to {} failed: {}", trimmed, e.getMessage());
            }
        }
        throw ApiRequestException.buildApiRequestException("All requests attempts failed: " + Joiner.on(", \n").join(errors));
    }

    public ApiEndpointConfig getConfig() {
        return config;
    }

    /**
     * Address used by the last successful request, or null.
     */
    public String getActiveAddress() {
        return activeAddress;
    }

    private String doRequest(String address, String method, String urlTemplate, String bodyTemplate,
                             Map<String, TemplateModel> context) throws IOException {
        HttpUriRequestBase request = httpRequestBuilder.buildRequest(
                address, method, urlTemplate, bodyTemplate, config, context);
        return httpRequestExecutor.executeRequest(request);
    }
}
