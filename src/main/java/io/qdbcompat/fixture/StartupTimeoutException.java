package io.qdbcompat.fixture;

import java.time.Duration;

/**
 * The instance did not answer queries within the startup timeout.
 */
public class StartupTimeoutException extends FixtureException {

    private final Duration timeout;

    public StartupTimeoutException(String instance, Duration timeout, Throwable cause) {
        super(instance + " did not become healthy within " + timeout.toSeconds() + " seconds", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
