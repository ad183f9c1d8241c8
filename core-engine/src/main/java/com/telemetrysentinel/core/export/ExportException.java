package com.telemetrysentinel.core.export;

/**
 * Raised by an {@link ExportSink} that could not accept a fault.
 *
 * @since 1.0.0
 */
public class ExportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
