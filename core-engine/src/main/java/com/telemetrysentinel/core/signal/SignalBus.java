package com.telemetrysentinel.core.signal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out of engine signals to subscribed listeners.
 *
 * <p>
 * Listeners subscribe either to every signal or to one {@link SignalType}.
 * Delivery is fire-and-forget: a listener that throws is logged and the
 * remaining listeners still receive the signal.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Subscription and publication may happen concurrently from any thread.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalBus {

    private static final Logger LOG = LoggerFactory.getLogger(SignalBus.class);

    private final List<SignalListener> allSignals = new CopyOnWriteArrayList<>();
    private final Map<SignalType, List<SignalListener>> byType = new EnumMap<>(SignalType.class);

    public SignalBus() {
        for (SignalType type : SignalType.values()) {
            byType.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Subscribe to every signal.
     *
     * @param listener the listener; must not be {@code null}
     */
    public void subscribe(SignalListener listener) {
        allSignals.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Subscribe to one kind of signal.
     *
     * @param type     signal type; must not be {@code null}
     * @param listener the listener; must not be {@code null}
     */
    public void subscribe(SignalType type, SignalListener listener) {
        Objects.requireNonNull(type, "type must not be null");
        byType.get(type).add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    /**
     * Remove a listener from every subscription it holds.
     *
     * @param listener the listener
     */
    public void unsubscribe(SignalListener listener) {
        allSignals.remove(listener);
        byType.values().forEach(list -> list.remove(listener));
    }

    /**
     * Deliver a signal to every interested listener.
     *
     * @param signal the signal; must not be {@code null}
     */
    public void publish(Signal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        LOG.debug("Publishing {}", signal);
        deliver(byType.get(signal.getType()), signal);
        deliver(allSignals, signal);
    }

    private static void deliver(List<SignalListener> listeners, Signal signal) {
        for (SignalListener listener : listeners) {
            try {
                listener.onSignal(signal);
            } catch (RuntimeException e) {
                LOG.error("Signal listener failed for {}, continuing with next listener",
                        signal.getType().wireName(), e);
            }
        }
    }
}
