package io.qdbcompat.poll;

/**
 * How {@link RetryPoller} treats a probe reporting a permanent failure.
 */
public enum FailurePolicy {

    /**
     * Keep polling until the deadline. A permanent failure counts as "not yet".
     */
    RETRY,

    /**
     * Stop at the first permanent failure and raise {@link PollFailedException}.
     */
    FAIL_FAST
}
