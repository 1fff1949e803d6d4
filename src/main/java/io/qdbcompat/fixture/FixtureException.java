package io.qdbcompat.fixture;

/**
 * A fixture could not be installed or started.
 */
public class FixtureException extends RuntimeException {

    public FixtureException(String message) {
        super(message);
    }

    public FixtureException(String message, Throwable cause) {
        super(message, cause);
    }
}
