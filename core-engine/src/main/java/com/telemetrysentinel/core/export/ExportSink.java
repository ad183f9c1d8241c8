package com.telemetrysentinel.core.export;

/**
 * External crash-reporting or alerting service that receives classified faults.
 *
 * <p>
 * Delivery is fire-and-forget from the engine's point of view: calls are made
 * off the ingestion path, retried a bounded number of times and then dropped.
 * </p>
 *
 * @since 1.0.0
 */
public interface ExportSink extends AutoCloseable {

    /**
     * @param fault the fault to deliver
     * @throws ExportException if the sink rejected or could not receive it
     */
    void send(ExportedFault fault);

    @Override
    default void close() {
        // nothing to release by default
    }
}
