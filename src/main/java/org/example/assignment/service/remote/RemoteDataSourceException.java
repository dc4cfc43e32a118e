package org.example.assignment.service.remote;

/**
 * Exception thrown when the backend rejects or fails a request.
 */
public class RemoteDataSourceException extends RuntimeException {

    public RemoteDataSourceException(String message) {
        super(message);
    }

    public RemoteDataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
