package com.acme.pgprecheck.util;

import com.acme.pgprecheck.exceptions.ProbeException;
import com.acme.pgprecheck.exceptions.ProbeTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeoutExecutor")
class TimeoutExecutorTest {

    @Nested
    @DisplayName("executeWithTimeout")
    class ExecuteWithTimeout {

        @Test
        @DisplayName("should return result when the call completes within timeout")
        void shouldReturnResultWithinTimeout() throws Exception {
            String result = TimeoutExecutor.executeWithTimeout("test", Duration.ofSeconds(5), () -> "success");

            assertThat(result).isEqualTo("success");
        }

        @Test
        @DisplayName("should throw ProbeTimeoutException when the call exceeds timeout")
        void shouldThrowWhenCallExceedsTimeout() {
            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("slowProbe", Duration.ofMillis(50), () -> {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "never";
            }))
                    .isInstanceOf(ProbeTimeoutException.class)
                    .hasMessageContaining("slowProbe")
                    .hasMessageContaining("50 ms");
        }

        @Test
        @DisplayName("should interrupt the call it abandons at the deadline")
        void shouldInterruptTimedOutCall() throws Exception {
            CountDownLatch interrupted = new CountDownLatch(1);

            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("hangingQuery", Duration.ofMillis(200), () -> {
                try {
                    Thread.sleep(3000);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                }
                return "late";
            })).isInstanceOf(ProbeTimeoutException.class);

            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }

        @Test
        @DisplayName("should propagate ProbeException unchanged")
        void shouldPropagateProbeException() {
            ProbeException failure = new ProbeException("x", "boom");

            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("test", Duration.ofSeconds(5), () -> {
                throw failure;
            })).isSameAs(failure);
        }

        @Test
        @DisplayName("should wrap runtime failures in ProbeException")
        void shouldWrapRuntimeFailures() {
            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("test", Duration.ofSeconds(5), () -> {
                throw new IllegalArgumentException("bad name");
            }))
                    .isInstanceOf(ProbeException.class)
                    .hasMessageContaining("bad name")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("disabled timeout")
    class Disabled {

        @Test
        @DisplayName("should run directly when timeout is null or zero")
        void shouldRunDirectly() throws Exception {
            assertThat(TimeoutExecutor.executeWithTimeout("test", null, () -> "direct")).isEqualTo("direct");
            assertThat(TimeoutExecutor.executeWithTimeout("test", Duration.ZERO, () -> "zero")).isEqualTo("zero");
        }

        @Test
        @DisplayName("should wrap runtime failures when running directly")
        void shouldWrapWhenDirect() {
            assertThatThrownBy(() -> TimeoutExecutor.executeWithTimeout("test", null, () -> {
                throw new IllegalStateException("oops");
            })).isInstanceOf(ProbeException.class).hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("isEnabled")
        void isEnabled() {
            assertThat(TimeoutExecutor.isEnabled(Duration.ofMillis(1))).isTrue();
            assertThat(TimeoutExecutor.isEnabled(Duration.ofMillis(-1))).isFalse();
            assertThat(TimeoutExecutor.isEnabled(null)).isFalse();
        }
    }
}
