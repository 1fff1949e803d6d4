package io.qdbcompat.run;

import io.qdbcompat.suite.ScenarioResult;
import io.qdbcompat.version.Version;
import java.util.List;

/**
 * Results of a run across the version matrix.
 */
public final class RunReport {

    private final List<VersionResult> results;
    private final List<Version> notAttempted;

    public RunReport(List<VersionResult> results, List<Version> notAttempted) {
        this.results = List.copyOf(results);
        this.notAttempted = List.copyOf(notAttempted);
    }

    public List<VersionResult> getResults() {
        return results;
    }

    /**
     * Gets the versions left untested because the run aborted early.
     */
    public List<Version> getNotAttempted() {
        return notAttempted;
    }

    public boolean wasSuccessful() {
        return !results.isEmpty() && notAttempted.isEmpty() && results.stream().allMatch(VersionResult::passed);
    }

    /**
     * Gets the process exit status: 0 if every version passed, 1 otherwise.
     */
    public int exitStatus() {
        return wasSuccessful() ? 0 : 1;
    }

    /**
     * Renders a human readable summary.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Compatibility run: ").append(wasSuccessful() ? "PASSED" : "FAILED").append('\n');
        for (VersionResult result : results) {
            sb.append("    ").append(result).append('\n');
            if (result.getSuiteResult() != null) {
                for (ScenarioResult failure : result.getSuiteResult().getFailures()) {
                    sb.append("        ").append(failure).append('\n');
                }
            }
        }
        if (!notAttempted.isEmpty()) {
            sb.append("    not attempted: ").append(notAttempted).append('\n');
        }
        return sb.toString();
    }
}
