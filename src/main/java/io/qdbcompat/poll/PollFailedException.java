package io.qdbcompat.poll;

/**
 * Raised under {@link FailurePolicy#FAIL_FAST} when a probe reports a permanent failure.
 */
public class PollFailedException extends RuntimeException {

    private final int attempts;

    public PollFailedException(String description, int attempts, RuntimeException cause) {
        super(description + " failed permanently after " + attempts + " attempts: " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
