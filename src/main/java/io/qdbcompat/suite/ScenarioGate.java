package io.qdbcompat.suite;

import io.qdbcompat.version.Version;
import java.util.Objects;

/**
 * Declares which server versions a scenario applies to.
 *
 * <p>A gate built with {@link #above(String, String)} excludes the gate version itself and
 * everything older.
 */
public final class ScenarioGate {

    private static final ScenarioGate ALWAYS = new ScenarioGate(null, null);

    private final Version threshold;
    private final String reason;

    private ScenarioGate(Version threshold, String reason) {
        this.threshold = threshold;
        this.reason = reason;
    }

    public static ScenarioGate always() {
        return ALWAYS;
    }

    /**
     * Runs the scenario only on versions newer than {@code version}.
     *
     * @param version last version without the feature
     * @param reason why older versions are skipped
     */
    public static ScenarioGate above(String version, String reason) {
        return new ScenarioGate(Version.parse(version), Objects.requireNonNull(reason, "reason"));
    }

    public boolean appliesTo(Version version) {
        return threshold == null || version.compareTo(threshold) > 0;
    }

    /**
     * Gets the skip reason, or {@code null} for an ungated scenario.
     */
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return threshold == null ? "always" : "above " + threshold;
    }
}
