package io.qdbcompat.suite;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one scenario against one version.
 */
public final class ScenarioResult {

    /**
     * Scenario status.
     */
    public enum Status {
        PASSED,
        FAILED,
        SKIPPED
    }

    private final String scenario;
    private final Status status;
    private final String message;
    private final Duration duration;

    private ScenarioResult(String scenario, Status status, String message, Duration duration) {
        this.scenario = Objects.requireNonNull(scenario, "scenario");
        this.status = status;
        this.message = message;
        this.duration = duration;
    }

    public static ScenarioResult passed(String scenario, Duration duration) {
        return new ScenarioResult(scenario, Status.PASSED, null, duration);
    }

    public static ScenarioResult failed(String scenario, String message, Duration duration) {
        return new ScenarioResult(scenario, Status.FAILED, message, duration);
    }

    public static ScenarioResult skipped(String scenario, String reason) {
        return new ScenarioResult(scenario, Status.SKIPPED, reason, Duration.ZERO);
    }

    public String getScenario() {
        return scenario;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * Gets the failure message or skip reason, or {@code null} for a passed scenario.
     */
    public String getMessage() {
        return message;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return scenario + ": " + status + (message == null ? "" : " (" + message + ")");
    }
}
