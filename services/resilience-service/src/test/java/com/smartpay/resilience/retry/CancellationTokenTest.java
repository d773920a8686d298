package com.smartpay.resilience.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CancellationToken Tests")
class CancellationTokenTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void shouldSleepWhenNotCancelled() {
        CancellationToken token = CancellationToken.create();

        assertThatCode(() -> token.sleep(Duration.ofMillis(10))).doesNotThrowAnyException();
        assertThat(token.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("Cancel wakes a sleeping thread")
    void shouldWakeOnCancel() throws Exception {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<Void> sleeper = CompletableFuture.runAsync(() -> token.sleep(Duration.ofMinutes(5)));

        token.cancel("shutdown");

        assertThatThrownBy(() -> sleeper.get(5, TimeUnit.SECONDS))
            .hasCauseInstanceOf(OperationCancelledException.class);
        assertThat(token.getReason()).isEqualTo("shutdown");
    }

    @Test
    @DisplayName("The first cancellation reason is kept")
    void shouldKeepFirstReason() {
        CancellationToken token = CancellationToken.create();

        token.cancel("first");
        token.cancel("second");

        assertThat(token.getReason()).isEqualTo("first");
        assertThatThrownBy(token::throwIfCancelled)
            .isInstanceOf(OperationCancelledException.class)
            .hasMessageContaining("first");
    }

    @Test
    @DisplayName("Interrupted threads are treated as cancelled and keep their interrupt flag")
    void shouldHonourInterrupts() {
        CancellationToken token = CancellationToken.create();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> token.sleep(Duration.ofSeconds(1)))
            .isInstanceOf(OperationCancelledException.class);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }
}
