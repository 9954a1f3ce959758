package org.apirepository.repository.exception;

/**
 * Thrown by a concrete repository when the remote API offers no equivalent of the
 * requested operation (for example, a read-only endpoint asked to delete a record).
 */
public class ApiOperationNotSupportedException extends UnsupportedOperationException {

    ApiOperationNotSupportedException(String message) {
        super(message);
    }

    /**
     * @param operation name of the unsupported repository operation
     * @param dataSource description of the data source
     * @return a new exception naming both
     */
    public static ApiOperationNotSupportedException buildApiOperationNotSupportedException(String operation, String dataSource) {
        return new ApiOperationNotSupportedException(
                "Operation '" + operation + "' is not supported by data source " + dataSource);
    }

    public static ApiOperationNotSupportedException buildApiOperationNotSupportedException(String message) {
        return new ApiOperationNotSupportedException(message);
    }
}
