package io.qdbcompat.poll;

import java.time.Duration;

/**
 * Raised when no probe attempt succeeded before the poll deadline.
 */
public class PollTimeoutException extends RuntimeException {

    private final Duration timeout;
    private final int attempts;

    public PollTimeoutException(String description, Duration timeout, int attempts, Throwable lastError) {
        super(description + " did not succeed within " + timeout.toMillis() + " ms (" + attempts + " attempts)"
                + (lastError == null ? "" : ", last error: " + lastError.getMessage()), lastError);
        this.timeout = timeout;
        this.attempts = attempts;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getAttempts() {
        return attempts;
    }
}
