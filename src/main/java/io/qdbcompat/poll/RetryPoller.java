package io.qdbcompat.poll;

import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded-retry primitive: attempts a {@link Probe} at a fixed interval until it succeeds or a
 * deadline passes.
 *
 * <p>The probe is always attempted at least once. Sleeps between attempts are clamped to the time
 * left before the deadline, so a poll that times out returns no later than the deadline plus the
 * duration of the last attempt.
 *
 * <p>Not meant for concurrent use against the same resource; each call blocks the calling thread.
 */
public final class RetryPoller {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPoller.class);

    private final Duration interval;
    private final FailurePolicy failurePolicy;

    public RetryPoller(Duration interval, FailurePolicy failurePolicy) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive: " + interval);
        }
        this.interval = interval;
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    public Duration getInterval() {
        return interval;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /**
     * Polls the probe until it succeeds.
     *
     * @param probe check to attempt
     * @param timeout how long to keep trying
     * @return the value of the first successful attempt
     * @throws PollTimeoutException if no attempt succeeded before the deadline
     * @throws PollFailedException if the probe failed permanently under {@link FailurePolicy#FAIL_FAST}
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    public <T> T poll(Probe<T> probe, Duration timeout) throws InterruptedException {
        return poll("probe", probe, timeout);
    }

    /**
     * Polls the probe until it succeeds, naming it in log lines and exception messages.
     */
    public <T> T poll(String description, Probe<T> probe, Duration timeout) throws InterruptedException {
        Objects.requireNonNull(probe, "probe");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        int attempts = 0;
        RuntimeException lastError = null;

        while (true) {
            attempts++;
            ProbeResult<T> result = probe.attempt();
            switch (result.getKind()) {
                case SUCCESS:
                    LOG.debug("{} succeeded after {} attempts", description, attempts);
                    return result.getValue();
                case PERMANENT_FAILURE:
                    if (failurePolicy == FailurePolicy.FAIL_FAST) {
                        throw new PollFailedException(description, attempts, result.getError());
                    }
                    lastError = result.getError();
                    break;
                default:
                    if (result.getError() != null) {
                        lastError = result.getError();
                    }
                    break;
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                LOG.warn("{} timed out after {} ms ({} attempts)", description, timeout.toMillis(), attempts);
                throw new PollTimeoutException(description, timeout, attempts, lastError);
            }

            LOG.debug("{} not satisfied on attempt {}: {}", description, attempts, result);
            Thread.sleep(Math.max(1L, Duration.ofNanos(Math.min(remaining, interval.toNanos())).toMillis()));
        }
    }
}
