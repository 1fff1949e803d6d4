package io.qdbcompat.fixture;

/**
 * Lifecycle states of a {@link Fixture}.
 */
public enum FixtureState {
    UNINSTALLED,
    INSTALLED,
    STARTING,
    RUNNING,
    STOPPED
}
