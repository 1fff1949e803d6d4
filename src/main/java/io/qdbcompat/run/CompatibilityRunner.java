package io.qdbcompat.run;

import io.qdbcompat.config.HarnessSettings;
import io.qdbcompat.fixture.Fixture;
import io.qdbcompat.fixture.FixtureException;
import io.qdbcompat.fixture.FixtureFactory;
import io.qdbcompat.query.ConsistencyCheck;
import io.qdbcompat.query.QueryClient;
import io.qdbcompat.suite.BehaviorSuite;
import io.qdbcompat.suite.ScenarioContext;
import io.qdbcompat.suite.SuiteResult;
import io.qdbcompat.version.ReleaseArtifact;
import io.qdbcompat.version.Version;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the behavior suite against each release of a version matrix, one instance at a time.
 *
 * <p>Every fixture that gets created is stopped before the next version starts, whether the suite
 * passed, failed or never ran. With {@link MatrixPolicy#ABORT_ON_FIRST_FAILURE} the remaining
 * versions are reported as not attempted after the first failure.
 */
public final class CompatibilityRunner {

    private static final Logger LOG = LoggerFactory.getLogger(CompatibilityRunner.class);

    private final FixtureFactory fixtureFactory;
    private final BehaviorSuite suite;
    private final HarnessSettings settings;

    public CompatibilityRunner(FixtureFactory fixtureFactory, BehaviorSuite suite, HarnessSettings settings) {
        this.fixtureFactory = Objects.requireNonNull(fixtureFactory, "fixtureFactory");
        this.suite = Objects.requireNonNull(suite, "suite");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Tests every release in iteration order.
     *
     * @param matrix releases to test, keyed by version
     * @return per-version results
     * @throws InterruptedException if interrupted; the live fixture is still stopped
     */
    public RunReport run(Map<Version, ReleaseArtifact> matrix) throws InterruptedException {
        Objects.requireNonNull(matrix, "matrix");
        List<VersionResult> results = new ArrayList<>(matrix.size());
        List<Version> notAttempted = new ArrayList<>();

        for (Map.Entry<Version, ReleaseArtifact> entry : matrix.entrySet()) {
            if (!notAttempted.isEmpty() || abortedAfter(results)) {
                notAttempted.add(entry.getKey());
                continue;
            }
            VersionResult result = runVersion(entry.getValue());
            results.add(result);
            if (result.passed()) {
                LOG.info("{}", result);
            } else {
                LOG.error("{}", result);
            }
        }

        RunReport report = new RunReport(results, notAttempted);
        if (!notAttempted.isEmpty()) {
            LOG.warn("Aborted after first failure, not attempted: {}", notAttempted);
        }
        return report;
    }

    private boolean abortedAfter(List<VersionResult> results) {
        return settings.getMatrixPolicy() == MatrixPolicy.ABORT_ON_FIRST_FAILURE
                && results.stream().anyMatch(r -> !r.passed());
    }

    private VersionResult runVersion(ReleaseArtifact artifact) throws InterruptedException {
        LOG.info("Testing {}", artifact);
        Version serverVersion = null;
        try (Fixture fixture = fixtureFactory.create(artifact)) {
            fixture.install();
            fixture.start();
            serverVersion = fixture.getVersion();
            SuiteResult suiteResult = suite.run(newContext(fixture));
            return VersionResult.completed(artifact, serverVersion, suiteResult);
        } catch (FixtureException e) {
            LOG.error("Fixture for {} failed", artifact, e);
            return VersionResult.errored(artifact, serverVersion, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while testing {}", artifact, e);
            return VersionResult.errored(artifact, serverVersion, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ScenarioContext newContext(Fixture fixture) {
        QueryClient queryClient = new QueryClient(fixture.getHttpAddress(), settings.getQueryTimeout());
        ConsistencyCheck consistencyCheck =
                new ConsistencyCheck(queryClient, settings.newPoller(), settings.getAwaitTimeout());
        return new ScenarioContext(fixture, consistencyCheck);
    }
}
