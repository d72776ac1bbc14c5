package com.whatshouldido.service.suggestion;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollaboratorInvokerTest {

    private final CollaboratorInvoker invoker = new CollaboratorInvoker(new SuggestionsProperties());

    @AfterEach
    void tearDown() {
        Thread.interrupted();
        invoker.shutdown();
    }

    @Test
    void returnsResultWithinDeadline() throws Exception {
        assertThat(invoker.call("test", () -> "ok", Duration.ofSeconds(1))).isEqualTo("ok");
    }

    @Test
    void timesOutSlowTask() {
        assertThatThrownBy(() -> invoker.call("slow", () -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        }, Duration.ofMillis(50))).isInstanceOf(TimeoutException.class);
    }

    @Test
    void taskFailureIsReportedWithCause() {
        assertThatThrownBy(() -> invoker.call("failing", () -> {
            throw new IllegalStateException("boom");
        }, Duration.ofSeconds(1)))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void interruptedCallerGetsCancellationAndKeepsInterruptFlag() {
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> invoker.call("any", () -> {
            try {
                TimeUnit.SECONDS.sleep(1);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "x";
        }, Duration.ofSeconds(2))).isInstanceOf(CancellationException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
