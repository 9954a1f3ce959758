package org.apirepository.freemarker.exception;

/**
 * Failure while rendering a request template, e.g. a reference to a variable
 * that is not part of the template context.
 */
public class FreeMarkerFormatException extends FreeMarkerException {

    public FreeMarkerFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public FreeMarkerFormatException(String message) {
        super(message);
    }
}
