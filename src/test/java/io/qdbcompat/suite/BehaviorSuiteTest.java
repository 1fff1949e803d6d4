package io.qdbcompat.suite;

import io.qdbcompat.poll.FailurePolicy;
import io.qdbcompat.poll.RetryPoller;
import io.qdbcompat.query.ConsistencyCheck;
import io.qdbcompat.query.QueryClient;
import io.qdbcompat.testutil.FakeFixture;
import io.qdbcompat.testutil.TestConstants;
import io.qdbcompat.version.Version;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BehaviorSuiteTest {

    private static ScenarioContext contextFor(String version) {
        FakeFixture fixture = FakeFixture.of(version);
        fixture.install();
        fixture.start();
        ConsistencyCheck check = new ConsistencyCheck(
                new QueryClient(fixture.getHttpAddress(), TestConstants.REQUEST_TIMEOUT),
                new RetryPoller(TestConstants.POLL_INTERVAL, FailurePolicy.RETRY),
                TestConstants.SHORT_TIMEOUT);
        return new ScenarioContext(fixture, check);
    }

    @Test
    void gatedScenariosAreSkippedWithoutBeingInvoked() throws Exception {
        List<String> invoked = new ArrayList<>();
        BehaviorSuite suite = new BehaviorSuite(List.of(
                Scenario.of("plain", context -> invoked.add("plain")),
                Scenario.gated("duplicates", ScenarioGate.above("6.1.2", "No support for duplicate column names."),
                        context -> invoked.add("duplicates"))));

        SuiteResult result = suite.run(contextFor("6.1.2"));

        Assertions.assertEquals(List.of("plain"), invoked);
        ScenarioResult skipped = result.getResults().get(1);
        Assertions.assertEquals(ScenarioResult.Status.SKIPPED, skipped.getStatus());
        Assertions.assertEquals("No support for duplicate column names.", skipped.getMessage());
        Assertions.assertTrue(result.wasSuccessful());
    }

    @Test
    void gatedScenariosRunOnNewerVersions() throws Exception {
        List<String> invoked = new ArrayList<>();
        BehaviorSuite suite = new BehaviorSuite(List.of(
                Scenario.gated("duplicates", ScenarioGate.above("6.1.2", "No support for duplicate column names."),
                        context -> invoked.add("duplicates"))));

        SuiteResult result = suite.run(contextFor("7.4.2"));

        Assertions.assertEquals(List.of("duplicates"), invoked);
        Assertions.assertEquals(1, result.count(ScenarioResult.Status.PASSED));
    }

    @Test
    void failuresAreRecordedAndOtherScenariosStillRun() throws Exception {
        List<String> invoked = new ArrayList<>();
        BehaviorSuite suite = new BehaviorSuite(List.of(
                Scenario.of("assertion", context -> Assertions.fail("columns differ")),
                Scenario.of("error", context -> {
                    throw new IllegalStateException("boom");
                }),
                Scenario.of("last", context -> invoked.add("last"))));

        SuiteResult result = suite.run(contextFor("7.4.2"));

        Assertions.assertEquals(List.of("last"), invoked);
        Assertions.assertFalse(result.wasSuccessful());
        Assertions.assertEquals(2, result.getFailures().size());
        Assertions.assertEquals("columns differ", result.getFailures().get(0).getMessage());
        Assertions.assertEquals("IllegalStateException: boom", result.getFailures().get(1).getMessage());
    }

    @Test
    void interruptionStopsTheSuite() {
        BehaviorSuite suite = new BehaviorSuite(List.of(
                Scenario.of("interrupted", context -> {
                    throw new InterruptedException("stop");
                })));

        Assertions.assertThrows(InterruptedException.class, () -> suite.run(contextFor("7.4.2")));
    }

    @Test
    void rejectsDuplicateScenarioNames() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new BehaviorSuite(List.of(
                Scenario.of("same", context -> { }),
                Scenario.of("same", context -> { }))));
    }

    @Test
    void selectKeepsSuiteOrder() {
        BehaviorSuite suite = BehaviorSuite.ingestion()
                .select(Set.of("funky_chars", "insert_three_rows"));

        Assertions.assertEquals(List.of("insert_three_rows", "funky_chars"), suite.getScenarioNames());
    }

    @Test
    void selectRejectsUnknownNames() {
        IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
                () -> BehaviorSuite.ingestion().select(List.of("no_such_scenario")));

        Assertions.assertTrue(e.getMessage().contains("no_such_scenario"), e.getMessage());
    }

    @Test
    void ingestionSuiteDeclaresItsGates() {
        List<String> names = BehaviorSuite.ingestion().getScenarioNames();

        Assertions.assertEquals(10, names.size());
        Assertions.assertTrue(names.contains("mismatched_types_across_rows"));
        Assertions.assertFalse(IngestionScenarios.DUPLICATE_NAMES.appliesTo(Version.parse("6.1.2")));
        Assertions.assertFalse(IngestionScenarios.UNICODE.appliesTo(Version.parse("6.0.7.1")));
        Assertions.assertFalse(IngestionScenarios.USER_TIMESTAMPS.appliesTo(Version.parse("6.0.7.1")));
    }
}
