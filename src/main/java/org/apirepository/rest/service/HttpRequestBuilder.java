package org.apirepository.rest.service;

import freemarker.template.TemplateModel;
import org.apirepository.freemarker.FreeMarkerEngine;
import org.apirepository.model.ApiEndpointConfig;
import org.apirepository.model.ApiHeader;
import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Method;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds HTTP requests for REST API communication with FreeMarker template processing.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Process URL and body templates with the request context</li>
 *   <li>Create GET/POST/PUT/PATCH/DELETE requests</li>
 *   <li>Configure request timeouts</li>
 *   <li>Add configured headers (values are templates too)</li>
 * </ul>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * HttpUriRequestBase request = builder.buildRequest(
 *     "http://api.example.com", "GET", "/users?offset=${offset}&limit=${limit}", null,
 *     config, contextBuilder.pageContext(config, 0, 20));
 * }</pre>
 */
public class HttpRequestBuilder {

    /**
     * @param address      Base URL of the REST service
     * @param method       HTTP method name
     * @param urlTemplate  Path template appended to the address
     * @param bodyTemplate Request body template, or null for no body
     * @param config       Endpoint configuration (timeouts, headers)
     * @param context      Template variables
     * @return Fully configured HTTP request
     * @throws IllegalArgumentException If the method is not supported
     */
    public HttpUriRequestBase buildRequest(
            String address,
            String method,
            String urlTemplate,
            String bodyTemplate,
            ApiEndpointConfig config,
            Map<String, TemplateModel> context) {

        String processedUrl = urlTemplate == null ? "" : FreeMarkerEngine.getInstance().process(urlTemplate, context);
        String uri = address + processedUrl;

        HttpUriRequestBase request = createRequest(method, uri);

        if (bodyTemplate != null) {
            String processedBody = FreeMarkerEngine.getInstance().process(bodyTemplate, context);
            request.setEntity(new StringEntity(processedBody, ContentType.APPLICATION_JSON));
        }

        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(config.getConnectionTimeout(), TimeUnit.SECONDS)
                .setResponseTimeout(config.getResponseTimeout(), TimeUnit.SECONDS)
                .build());

        if (config.getApiHeaders() != null) {
            for (ApiHeader apiHeader : config.getApiHeaders()) {
                String processedValue = FreeMarkerEngine.getInstance().process(apiHeader.getValue(), context);
                request.setHeader(apiHeader.getKey(), processedValue);
            }
        }

        return request;
    }

    private HttpUriRequestBase createRequest(String method, String uri) {
        Method httpMethod = Method.normalizedValueOf(method == null ? "GET" : method);
        switch (httpMethod) {
            case GET:
                return new HttpGet(uri);
            case POST:
                return new HttpPost(uri);
            case PUT:
                return new HttpPut(uri);
            case PATCH:
                return new HttpPatch(uri);
            case DELETE:
                return new HttpDelete(uri);
            default:
                throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }
    }
}
