package org.apirepository.rest.exception;

import lombok.Getter;

/**
 * Failure of an HTTP call to a REST endpoint: unsuccessful status, unreachable addresses
 * or a response that cannot be parsed.
 */
@Getter
public class ApiRequestException extends RuntimeException {

    /** Marker for failures that did not produce an HTTP status. */
    public static final int NO_STATUS = -1;

    /** HTTP status code, or {@link #NO_STATUS}. */
    private final int statusCode;

    ApiRequestException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public static ApiRequestException buildApiRequestException(int statusCode) {
        return new ApiRequestException("Request Failed, status code (" + statusCode + ")", statusCode, null);
    }

    public static ApiRequestException buildApiRequestException(String message) {
        return new ApiRequestException(message, NO_STATUS, null);
    }

    public static ApiRequestException buildApiRequestException(String message, Throwable cause) {
        return new ApiRequestException(message, NO_STATUS, cause);
    }
}
