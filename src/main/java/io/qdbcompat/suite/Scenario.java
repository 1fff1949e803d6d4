package io.qdbcompat.suite;

import java.util.Objects;

/**
 * A named ingestion behavior, optionally limited to newer server versions.
 */
public final class Scenario {

    private final String name;
    private final ScenarioGate gate;
    private final ScenarioBody body;

    public Scenario(String name, ScenarioGate gate, ScenarioBody body) {
        this.name = Objects.requireNonNull(name, "name");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.body = Objects.requireNonNull(body, "body");
    }

    public static Scenario of(String name, ScenarioBody body) {
        return new Scenario(name, ScenarioGate.always(), body);
    }

    public static Scenario gated(String name, ScenarioGate gate, ScenarioBody body) {
        return new Scenario(name, gate, body);
    }

    public String getName() {
        return name;
    }

    public ScenarioGate getGate() {
        return gate;
    }

    public ScenarioBody getBody() {
        return body;
    }

    @Override
    public String toString() {
        return name;
    }
}
