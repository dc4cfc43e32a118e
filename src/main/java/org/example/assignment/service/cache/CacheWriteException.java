package org.example.assignment.service.cache;

/**
 * A value could not be written to the cache store. Never escapes {@link TtlCache}.
 */
public class CacheWriteException extends RuntimeException {

    public CacheWriteException(String message) {
        super(message);
    }

    public CacheWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
