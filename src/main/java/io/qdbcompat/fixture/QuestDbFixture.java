package io.qdbcompat.fixture;

import io.qdbcompat.config.Defaults;
import io.qdbcompat.config.HarnessSettings;
import io.qdbcompat.poll.PollFailedException;
import io.qdbcompat.poll.PollTimeoutException;
import io.qdbcompat.poll.ProbeResult;
import io.qdbcompat.query.MalformedResponseException;
import io.qdbcompat.query.QueryClient;
import io.qdbcompat.query.QueryErrorException;
import io.qdbcompat.query.QueryException;
import io.qdbcompat.query.QueryResponse;
import io.qdbcompat.query.TransportException;
import io.qdbcompat.version.ReleaseArtifact;
import io.qdbcompat.version.Version;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.images.RemoteDockerImage;

/**
 * A QuestDB release running in a Docker container managed by Testcontainers.
 *
 * <p>Installing pulls the release image. Starting runs it with the HTTP and ILP ports exposed,
 * waits for the ports to listen, then polls {@code select 1} until the query endpoint answers.
 * The server version is read back with {@code select build()} and falls back to the image tag on
 * releases that lack that function.
 */
public final class QuestDbFixture implements Fixture {

    private static final Logger LOG = LoggerFactory.getLogger(QuestDbFixture.class);

    private static final Pattern BUILD_VERSION = Pattern.compile("QuestDB (\\d+(?:\\.\\d+)+)");

    private final ReleaseArtifact artifact;
    private final HarnessSettings settings;

    private FixtureState state = FixtureState.UNINSTALLED;
    private RemoteDockerImage image;
    private GenericContainer<?> container;
    private URI httpAddress;
    private String ilpAddress;
    private Version version;

    public QuestDbFixture(ReleaseArtifact artifact, HarnessSettings settings) {
        this.artifact = Objects.requireNonNull(artifact, "artifact");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public ReleaseArtifact getArtifact() {
        return artifact;
    }

    @Override
    public FixtureState getState() {
        return state;
    }

    @Override
    public void install() {
        if (state == FixtureState.INSTALLED) {
            return;
        }
        if (state != FixtureState.UNINSTALLED) {
            throw new IllegalStateException("Cannot install " + artifact + " in state " + state);
        }

        LOG.info("Installing {}", artifact);
        RemoteDockerImage remoteImage = new RemoteDockerImage(artifact.getImage());
        try {
            remoteImage.get();
        } catch (Exception e) {
            throw new FixtureException("Could not install " + artifact, e);
        }
        image = remoteImage;
        state = FixtureState.INSTALLED;
    }

    @Override
    public void start() throws InterruptedException {
        if (state != FixtureState.INSTALLED) {
            throw new IllegalStateException("Cannot start " + artifact + " in state " + state);
        }
        state = FixtureState.STARTING;
        Duration startupTimeout = settings.getStartupTimeout();
        long startedAt = System.nanoTime();

        container = new GenericContainer<>(image)
                .withExposedPorts(Defaults.HTTP_PORT, Defaults.ILP_PORT)
                .withEnv("QDB_TELEMETRY_ENABLED", "false")
                .waitingFor(Wait.forListeningPort().withStartupTimeout(startupTimeout));
        try {
            container.start();
        } catch (RuntimeException e) {
            if (elapsed(startedAt).compareTo(startupTimeout) >= 0) {
                throw new StartupTimeoutException(artifact.toString(), startupTimeout, e);
            }
            throw new FixtureException("Could not launch " + artifact, e);
        }

        httpAddress = URI.create("http://" + container.getHost() + ":" + container.getMappedPort(Defaults.HTTP_PORT));
        ilpAddress = container.getHost() + ":" + container.getMappedPort(Defaults.ILP_PORT);
        QueryClient queryClient = new QueryClient(httpAddress, settings.getQueryTimeout());

        Duration remaining = startupTimeout.minus(elapsed(startedAt));
        try {
            settings.newPoller().poll(artifact + " health check", () -> checkHealth(queryClient),
                    remaining.isNegative() ? Duration.ZERO : remaining);
        } catch (PollTimeoutException e) {
            throw new StartupTimeoutException(artifact.toString(), startupTimeout, e);
        } catch (PollFailedException e) {
            throw new FixtureException(artifact + " answered with an unusable response", e);
        }

        version = resolveVersion(queryClient);
        state = FixtureState.RUNNING;
        LOG.info("QuestDB {} running: http={}, ilp={}", version, httpAddress, ilpAddress);
    }

    private static ProbeResult<Boolean> checkHealth(QueryClient queryClient) throws InterruptedException {
        try {
            queryClient.query("select 1");
            return ProbeResult.success(Boolean.TRUE);
        } catch (TransportException e) {
            return ProbeResult.notYet(e);
        } catch (QueryErrorException e) {
            // The server is up and answering.
            return ProbeResult.success(Boolean.TRUE);
        } catch (MalformedResponseException e) {
            return ProbeResult.permanentFailure(e);
        }
    }

    private Version resolveVersion(QueryClient queryClient) throws InterruptedException {
        try {
            QueryResponse response = queryClient.query("select build()");
            if (response.getRowCount() > 0 && !response.getDataset().get(0).isEmpty()) {
                Matcher matcher = BUILD_VERSION.matcher(String.valueOf(response.getDataset().get(0).get(0)));
                if (matcher.find()) {
                    return Version.parse(matcher.group(1));
                }
            }
            LOG.warn("No version in build() output of {}, using tag {}", artifact, artifact.getTag());
        } catch (QueryException e) {
            LOG.warn("Could not read version of {}, using tag {}: {}", artifact, artifact.getTag(), e.getMessage());
        }
        return artifact.getVersion();
    }

    private static Duration elapsed(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }

    @Override
    public void stop() {
        if (state == FixtureState.STOPPED) {
            return;
        }
        try {
            if (container != null) {
                LOG.info("Stopping {}", artifact);
                container.stop();
            }
        } finally {
            container = null;
            state = FixtureState.STOPPED;
        }
    }

    @Override
    public Version getVersion() {
        requireRunning();
        return version;
    }

    @Override
    public String getIlpAddress() {
        requireRunning();
        return ilpAddress;
    }

    @Override
    public URI getHttpAddress() {
        requireRunning();
        return httpAddress;
    }

    private void requireRunning() {
        if (state != FixtureState.RUNNING) {
            throw new IllegalStateException(artifact + " is not running (state " + state + ")");
        }
    }

    @Override
    public String toString() {
        return "QuestDbFixture{" + artifact + ", state=" + state + "}";
    }
}
