package org.example.pysolver.index;

import org.example.pysolver.exception.IndexException;
import org.example.pysolver.exception.PackageNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RetryExecutor.
 */
class RetryExecutorTest {

    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        // Use short backoff for faster tests
        executor = new RetryExecutor(3, 10);
    }

    @Nested
    @DisplayName("Successful Execution")
    class SuccessfulExecution {

        @Test
        @DisplayName("should return result on first success")
        void shouldReturnResultOnFirstSuccess() throws IndexException {
            String result = executor.execute(() -> "success", "test operation");

            assertThat(result).isEqualTo("success");
        }

        @Test
        @DisplayName("should succeed after retries")
        void shouldSucceedAfterRetries() throws IndexException {
            AtomicInteger attempts = new AtomicInteger(0);

            String result = executor.execute(() -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new ConnectException("Connection refused");
                }
                return "success on third attempt";
            }, "test operation");

            assertThat(result).isEqualTo("success on third attempt");
            assertThat(attempts.get()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Retryable Exceptions")
    class RetryableExceptions {

        @Test
        @DisplayName("should retry on SocketTimeoutException")
        void shouldRetryOnSocketTimeoutException() {
            assertThat(executor.isRetryable(new SocketTimeoutException("timeout"))).isTrue();
        }

        @Test
        @DisplayName("should retry on ConnectException")
        void shouldRetryOnConnectException() {
            assertThat(executor.isRetryable(new ConnectException("refused"))).isTrue();
        }

        @Test
        @DisplayName("should retry on IOException with connection message")
        void shouldRetryOnConnectionIOException() {
            assertThat(executor.isRetryable(new IOException("Connection reset"))).isTrue();
            assertThat(executor.isRetryable(new IOException("Network unreachable"))).isTrue();
        }

        @Test
        @DisplayName("should retry on index server error")
        void shouldRetryOnServerError() {
            assertThat(executor.isRetryable(new IndexException("HTTP 503", true))).isTrue();
        }

        @Test
        @DisplayName("should retry on wrapped connection exception")
        void shouldRetryOnWrappedException() {
            Exception wrapped = new RuntimeException("Wrapper", new ConnectException("refused"));
            assertThat(executor.isRetryable(wrapped)).isTrue();
        }
    }

    @Nested
    @DisplayName("Non-Retryable Exceptions")
    class NonRetryableExceptions {

        @Test
        @DisplayName("should not retry on unknown package")
        void shouldNotRetryOnPackageNotFound() {
            assertThat(executor.isRetryable(new PackageNotFoundException("flask", "https://pypi.org/simple")))
                    .isFalse();
        }

        @Test
        @DisplayName("should not retry on index client error")
        void shouldNotRetryOnClientError() {
            assertThat(executor.isRetryable(new IndexException("HTTP 401", false))).isFalse();
        }

        @Test
        @DisplayName("should not retry on generic runtime exception")
        void shouldNotRetryOnGenericRuntimeException() {
            assertThat(executor.isRetryable(new RuntimeException("Some error"))).isFalse();
        }

        @Test
        @DisplayName("should not retry on null")
        void shouldNotRetryOnNull() {
            assertThat(executor.isRetryable(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Failed Execution")
    class FailedExecution {

        @Test
        @DisplayName("should throw after max retries for retryable error")
        void shouldThrowAfterMaxRetries() {
            AtomicInteger attempts = new AtomicInteger(0);

            assertThatThrownBy(() -> executor.execute(() -> {
                attempts.incrementAndGet();
                throw new ConnectException("Connection refused");
            }, "connect"))
                    .isInstanceOf(IndexException.class)
                    .hasMessageContaining("connect")
                    .hasMessageContaining("3 attempts")
                    .hasCauseInstanceOf(ConnectException.class);

            assertThat(attempts.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("should rethrow index exceptions unwrapped")
        void shouldRethrowIndexExceptionUnwrapped() {
            AtomicInteger attempts = new AtomicInteger(0);
            PackageNotFoundException notFound = new PackageNotFoundException("nope", "https://pypi.org/simple");

            assertThatThrownBy(() -> executor.execute(() -> {
                attempts.incrementAndGet();
                throw notFound;
            }, "fetch"))
                    .isSameAs(notFound);

            // Should only attempt once
            assertThat(attempts.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("should wrap non-retryable error")
        void shouldWrapNonRetryable() {
            assertThatThrownBy(() -> executor.execute(() -> {
                throw new IllegalStateException("broken");
            }, "parse"))
                    .isInstanceOf(IndexException.class)
                    .hasMessageContaining("parse failed")
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Configuration")
    class Configuration {

        @Test
        @DisplayName("should use default settings")
        void shouldUseDefaultSettings() {
            RetryExecutor defaultExecutor = new RetryExecutor();

            assertThat(defaultExecutor.getMaxAttempts()).isEqualTo(3);
            assertThat(defaultExecutor.getBackoffMs()).isEqualTo(2000);
        }

        @Test
        @DisplayName("should reject less than one attempt")
        void shouldRejectZeroAttempts() {
            assertThatThrownBy(() -> new RetryExecutor(0, 10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
