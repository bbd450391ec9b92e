package org.example.pysolver.index;

import org.example.pysolver.exception.IndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.Callable;

/**
 * Executes index requests with retry logic for transient failures.
 *
 * <p>Retry is triggered ONLY for:</p>
 * <ul>
 *   <li>Connection timeout (SocketTimeoutException)</li>
 *   <li>Connection refused (ConnectException)</li>
 *   <li>Network errors (IOException subtypes related to network)</li>
 *   <li>Server errors reported by the index (HTTP 5xx)</li>
 * </ul>
 *
 * <p>NO retry for:</p>
 * <ul>
 *   <li>Unknown packages (HTTP 404)</li>
 *   <li>Other client errors, e.g. authentication failures</li>
 *   <li>Malformed index responses</li>
 * </ul>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final int maxAttempts;
    private final long backoffMs;

    /**
     * Creates a RetryExecutor with default settings (3 attempts, 2s backoff).
     */
    public RetryExecutor() {
        this(3, 2000);
    }

    /**
     * Creates a RetryExecutor with custom settings.
     *
     * @param maxAttempts maximum number of attempts
     * @param backoffMs   backoff time in milliseconds between attempts
     */
    public RetryExecutor(int maxAttempts, long backoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, but was: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.backoffMs = backoffMs;
    }

    /**
     * Executes the given operation with retry logic.
     *
     * @param operation   the operation to execute
     * @param description description for logging
     * @param <T>         the return type
     * @return the operation result
     * @throws IndexException if all attempts are exhausted or a non-retryable error occurs
     */
    public <T> T execute(Callable<T> operation, String description) throws IndexException {
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastException = e;

                if (!isRetryable(e)) {
                    log.debug("{} failed with non-retryable error: {}", description, e.getMessage());
                    throw wrapException(e, description);
                }

                if (attempt < maxAttempts) {
                    log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                            description, attempt, maxAttempts, backoffMs, e.getMessage());
                    sleep(backoffMs);
                } else {
                    log.error("{} failed after {} attempts: {}",
                            description, maxAttempts, e.getMessage());
                }
            }
        }

        throw new IndexException(
                String.format("%s failed after %d attempts", description, maxAttempts),
                lastException
        );
    }

    /**
     * Determines if the given exception is retryable.
     */
    public boolean isRetryable(Throwable e) {
        if (e == null) {
            return false;
        }

        if (e instanceof IndexException) {
            return ((IndexException) e).isServerError() || isRetryable(e.getCause());
        }

        if (isConnectionException(e)) {
            return true;
        }

        // Check wrapped exceptions
        Throwable cause = e.getCause();
        while (cause != null) {
            if (isConnectionException(cause)) {
                return true;
            }
            cause = cause.getCause();
        }

        return false;
    }

    /**
     * Checks if the exception is a connection-related exception.
     */
    private boolean isConnectionException(Throwable e) {
        if (e instanceof SocketTimeoutException) {
            return true;
        }
        if (e instanceof ConnectException) {
            return true;
        }
        // General network I/O errors (but not all IOExceptions)
        if (e instanceof IOException) {
            String message = e.getMessage();
            if (message != null) {
                String lowerMessage = message.toLowerCase();
                return lowerMessage.contains("connection") ||
                       lowerMessage.contains("network") ||
                       lowerMessage.contains("timeout") ||
                       lowerMessage.contains("refused") ||
                       lowerMessage.contains("unreachable") ||
                       lowerMessage.contains("reset");
            }
        }
        return false;
    }

    /**
     * Wraps the exception in an IndexException.
     */
    private IndexException wrapException(Exception e, String description) {
        if (e instanceof IndexException) {
            return (IndexException) e;
        }
        return new IndexException(description + " failed: " + e.getMessage(), e);
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Retry sleep interrupted");
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBackoffMs() {
        return backoffMs;
    }
}
