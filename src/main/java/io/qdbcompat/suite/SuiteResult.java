package io.qdbcompat.suite;

import java.util.List;

/**
 * Scenario outcomes for one version, in execution order.
 */
public final class SuiteResult {

    private final List<ScenarioResult> results;

    public SuiteResult(List<ScenarioResult> results) {
        this.results = List.copyOf(results);
    }

    public List<ScenarioResult> getResults() {
        return results;
    }

    public long count(ScenarioResult.Status status) {
        return results.stream().filter(r -> r.getStatus() == status).count();
    }

    public List<ScenarioResult> getFailures() {
        return results.stream()
                .filter(r -> r.getStatus() == ScenarioResult.Status.FAILED)
                .toList();
    }

    public boolean wasSuccessful() {
        return getFailures().isEmpty();
    }

    @Override
    public String toString() {
        return "passed=" + count(ScenarioResult.Status.PASSED)
                + ", failed=" + count(ScenarioResult.Status.FAILED)
                + ", skipped=" + count(ScenarioResult.Status.SKIPPED);
    }
}
