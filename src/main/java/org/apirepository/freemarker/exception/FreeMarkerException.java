package org.apirepository.freemarker.exception;

/**
 * Failure while compiling a request template (URL, header or body).
 */
public class FreeMarkerException extends RuntimeException {

    public FreeMarkerException(String message, Throwable cause) {
        super(message, cause);
    }

    public FreeMarkerException(String message) {
        super(message);
    }
}
