package com.telemetrysentinel.core.signal;

/**
 * Receives signals emitted by the engine.
 *
 * <p>
 * Listeners are called synchronously on the emitting thread (an ingestion
 * caller or a sweep thread) and must therefore return quickly; anything slow
 * belongs on the listener's own executor. Exceptions are logged by the
 * {@link SignalBus} and do not reach the emitter.
 * </p>
 */
@FunctionalInterface
public interface SignalListener {

    void onSignal(Signal signal);
}
