package org.apirepository.freemarker.exception;

/**
 * Raised when a Java value cannot be wrapped as a FreeMarker {@code TemplateModel}.
 */
public class ConvertException extends RuntimeException {

    public ConvertException(String message) {
        super(message);
    }

    public ConvertException(Throwable cause) {
        super(cause);
    }

    public static ConvertException buildConvertException(Throwable cause) {
        return new ConvertException(cause);
    }

}
