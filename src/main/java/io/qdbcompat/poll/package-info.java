/**
 * Deadline-bounded polling of probes. A {@link io.qdbcompat.poll.RetryPoller} always makes at least one
 * attempt and never sleeps past its deadline.
 */
package io.qdbcompat.poll;
