package com.telemetrysentinel.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Unit tests for {@link BackgroundDispatcher}.
 */
class BackgroundDispatcherTest {

    @Test
    @DisplayName("A task that keeps failing is attempted exactly maxAttempts times")
    void shouldRetryBoundedly() {
        BackgroundDispatcher dispatcher = new BackgroundDispatcher(Runnable::run, 3, Duration.ZERO);
        AtomicInteger attempts = new AtomicInteger();

        dispatcher.dispatch("always fails", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("store down");
        });

        assertThat(attempts).hasValue(3);
        assertThat(dispatcher.failedCount()).isEqualTo(1);
        assertThat(dispatcher.completedCount()).isZero();
    }

    @Test
    @DisplayName("A task that recovers stops retrying")
    void shouldStopAfterSuccess() {
        BackgroundDispatcher dispatcher = new BackgroundDispatcher(Runnable::run, 3, Duration.ZERO);
        AtomicInteger attempts = new AtomicInteger();

        dispatcher.dispatch("flaky", () -> {
            if (attempts.incrementAndGet() < 2) {
                throw new IllegalStateException("transient");
            }
        });

        assertThat(attempts).hasValue(2);
        assertThat(dispatcher.completedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A rejected task is dropped without throwing")
    void shouldDropRejectedTasks() {
        BackgroundDispatcher dispatcher = new BackgroundDispatcher(task -> {
            throw new RejectedExecutionException("queue full");
        }, 3, Duration.ZERO);

        assertThatCode(() -> dispatcher.dispatch("dropped", () -> { })).doesNotThrowAnyException();
        assertThat(dispatcher.rejectedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Pooled dispatcher runs tasks off the caller thread and drains on close")
    void shouldRunOnPoolAndDrain() throws InterruptedException {
        BackgroundDispatcher dispatcher = BackgroundDispatcher.pooled(2, 1, Duration.ZERO);
        CountDownLatch done = new CountDownLatch(5);
        Thread caller = Thread.currentThread();
        AtomicInteger onCaller = new AtomicInteger();

        for (int i = 0; i < 5; i++) {
            dispatcher.dispatch("task " + i, () -> {
                if (Thread.currentThread() == caller) {
                    onCaller.incrementAndGet();
                }
                done.countDown();
            });
        }
        dispatcher.close();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(onCaller).hasValue(0);
        assertThat(dispatcher.completedCount()).isEqualTo(5);
    }
}
