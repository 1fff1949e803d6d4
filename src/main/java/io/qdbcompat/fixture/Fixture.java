package io.qdbcompat.fixture;

import io.qdbcompat.version.ReleaseArtifact;
import io.qdbcompat.version.Version;
import io.questdb.client.Sender;
import java.net.URI;

/**
 * One managed QuestDB instance.
 *
 * <p>A fixture moves through {@link FixtureState#UNINSTALLED}, {@link FixtureState#INSTALLED},
 * {@link FixtureState#STARTING}, {@link FixtureState#RUNNING} and {@link FixtureState#STOPPED}.
 * Whoever starts a fixture must stop it on every exit path; {@link #stop()} is safe to call in any
 * state, including after a failed {@link #start()}.
 */
public interface Fixture extends AutoCloseable {

    ReleaseArtifact getArtifact();

    FixtureState getState();

    /**
     * Makes the release runnable. Calling it again on an installed fixture does nothing.
     *
     * @throws FixtureException if the release could not be installed
     * @throws IllegalStateException if the fixture was already started
     */
    void install() throws InterruptedException;

    /**
     * Starts the instance and blocks until its query endpoint answers.
     *
     * @throws StartupTimeoutException if the instance did not become healthy in time
     * @throws FixtureException if the instance could not be launched
     * @throws IllegalStateException if the fixture is not installed
     */
    void start() throws InterruptedException;

    /**
     * Stops the instance, if any, and moves to {@link FixtureState#STOPPED}.
     */
    void stop();

    /**
     * Gets the version reported by the running server.
     */
    Version getVersion();

    /**
     * Gets the ILP endpoint as {@code host:port}.
     */
    String getIlpAddress();

    /**
     * Gets the root of the HTTP server, e.g. {@code http://localhost:32768}.
     */
    URI getHttpAddress();

    /**
     * Opens an ILP/TCP sender connected to this instance.
     */
    default Sender newSender() {
        return Sender.fromConfig("tcp::addr=" + getIlpAddress() + ";");
    }

    @Override
    default void close() {
        stop();
    }
}
