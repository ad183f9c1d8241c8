package com.telemetrysentinel.core.storage;

/**
 * Raised by a {@link KeyValueStore} when a read or write cannot be completed.
 *
 * @since 1.0.0
 */
public class StoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
