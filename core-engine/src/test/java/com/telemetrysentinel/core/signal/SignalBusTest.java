package com.telemetrysentinel.core.signal;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SignalBus}.
 */
class SignalBusTest {

    private SignalBus bus;

    @BeforeEach
    void setUp() {
        bus = new SignalBus();
    }

    @Test
    @DisplayName("Typed listeners only receive their type; catch-all listeners receive everything")
    void shouldRouteByType() {
        List<Signal> critical = new ArrayList<>();
        List<Signal> all = new ArrayList<>();
        bus.subscribe(SignalType.CRITICAL_ERROR, critical::add);
        bus.subscribe(all::add);

        bus.publish(signal(SignalType.ERROR_RECORDED));
        bus.publish(signal(SignalType.CRITICAL_ERROR));

        assertThat(critical).extracting(Signal::getType).containsExactly(SignalType.CRITICAL_ERROR);
        assertThat(all).extracting(Signal::getType)
                .containsExactly(SignalType.ERROR_RECORDED, SignalType.CRITICAL_ERROR);
    }

    @Test
    @DisplayName("A failing listener does not stop delivery to the others")
    void shouldIsolateListenerFailures() {
        List<Signal> received = new ArrayList<>();
        bus.subscribe(s -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe(received::add);

        bus.publish(signal(SignalType.PATTERN_ALERT));

        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Unsubscribed listeners receive nothing further")
    void shouldUnsubscribe() {
        List<Signal> received = new ArrayList<>();
        SignalListener listener = received::add;
        bus.subscribe(listener);
        bus.subscribe(SignalType.ANOMALY_DETECTED, listener);

        bus.unsubscribe(listener);
        bus.publish(signal(SignalType.ANOMALY_DETECTED));

        assertThat(received).isEmpty();
    }

    @Test
    @DisplayName("Signals require a type and a timestamp")
    void shouldRequireTypeAndTimestamp() {
        assertThatThrownBy(() -> Signal.builder().timestamp(Instant.now()).build())
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Signal.builder().type(SignalType.ERROR_RECORDED).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("Wire names are kebab-case")
    void shouldExposeWireNames() {
        assertThat(SignalType.PERFORMANCE_REGRESSION.wireName()).isEqualTo("performance-regression");
        assertThat(SignalType.ANOMALY_DETECTED.wireName()).isEqualTo("anomaly-detected");
    }

    private static Signal signal(SignalType type) {
        return Signal.builder().type(type).timestamp(Instant.EPOCH).key("k").payload("p").build();
    }
}
