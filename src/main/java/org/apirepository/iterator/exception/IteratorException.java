package org.apirepository.iterator.exception;

/**
 * Raised for a fault caught while traversing an {@link org.apirepository.iterator.ApiIterator}:
 * a failed page fetch, an undecodable record, or a predicate that threw.
 */
public class IteratorException extends RuntimeException {

    public static final String DEFAULT_MESSAGE = "A problem occurred during the iteration operation.";

    public IteratorException(String message) {
        super(message);
    }

    public IteratorException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps a traversal fault with the default message.
     *
     * @param cause the original fault
     * @return a new IteratorException
     */
    public static IteratorException buildIteratorException(Throwable cause) {
        return new IteratorException(DEFAULT_MESSAGE, cause);
    }
}
