package io.qdbcompat.poll;

/**
 * A single check, invoked repeatedly by {@link RetryPoller}.
 *
 * @param <T> type of the value produced on success
 */
@FunctionalInterface
public interface Probe<T> {

    ProbeResult<T> attempt() throws InterruptedException;
}
