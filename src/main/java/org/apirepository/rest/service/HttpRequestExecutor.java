package org.apirepository.rest.service;

import org.apirepository.rest.exception.ApiRequestException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Executes HTTP requests and handles responses for REST API communication.
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299. A response without
 * entity (e.g. 204 after a delete) yields an empty body.</p>
 *
 * <p><b>Note:</b> Uses a shared HttpClient instance for connection pooling.</p>
 */
public class HttpRequestExecutor {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private static final CloseableHttpClient SHARED_HTTP_CLIENT = HttpClientBuilder.create().build();

    /**
     * Executes an HTTP request and returns the response body as string.
     *
     * @param request Configured HTTP request to execute
     * @return Response body as UTF-8 string, empty if the response has no entity
     * @throws IOException If the request could not be sent or the response not read
     * @throws ApiRequestException If the response status is not successful
     */
    public String executeRequest(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return SHARED_HTTP_CLIENT.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            if (!isSuccessfulResponse(statusCode)) {
                throw ApiRequestException.buildApiRequestException(statusCode);
            }

            HttpEntity entity = response.getEntity();
            if (entity == null) {
                return "";
            }

            try (InputStream is = entity.getContent()) {
                String responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                logger.debug("Response Body: {}", responseBody);
                return responseBody;
            }
        });
    }

    private boolean isSuccessfulResponse(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());
        for (var header : request.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }

    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        for (var header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
