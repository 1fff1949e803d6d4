package io.qdbcompat.suite;

import io.qdbcompat.version.Version;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An ordered set of scenarios run against one instance.
 *
 * <p>Each scenario's gate is checked against the instance version before the scenario is invoked;
 * gated-out scenarios are reported as skipped. A failing scenario does not stop the others.
 */
public final class BehaviorSuite {

    private static final Logger LOG = LoggerFactory.getLogger(BehaviorSuite.class);

    private final List<Scenario> scenarios;

    public BehaviorSuite(List<Scenario> scenarios) {
        Set<String> names = new LinkedHashSet<>();
        for (Scenario scenario : scenarios) {
            if (!names.add(scenario.getName())) {
                throw new IllegalArgumentException("Duplicate scenario name: " + scenario.getName());
            }
        }
        this.scenarios = List.copyOf(scenarios);
    }

    /**
     * Creates the suite of ingestion scenarios.
     */
    public static BehaviorSuite ingestion() {
        return new BehaviorSuite(IngestionScenarios.all());
    }

    public List<Scenario> getScenarios() {
        return scenarios;
    }

    public List<String> getScenarioNames() {
        return scenarios.stream().map(Scenario::getName).toList();
    }

    /**
     * Restricts the suite to the named scenarios, keeping suite order. An empty selection keeps
     * every scenario.
     *
     * @throws IllegalArgumentException if a name does not match any scenario
     */
    public BehaviorSuite select(Collection<String> names) {
        Objects.requireNonNull(names, "names");
        if (names.isEmpty()) {
            return this;
        }
        List<String> unknown = new ArrayList<>(names);
        unknown.removeAll(getScenarioNames());
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown scenario(s) " + unknown + ", available: " + getScenarioNames());
        }
        return new BehaviorSuite(scenarios.stream().filter(s -> names.contains(s.getName())).toList());
    }

    /**
     * Runs every scenario against the instance behind the context.
     *
     * @throws InterruptedException if a scenario was interrupted
     */
    public SuiteResult run(ScenarioContext context) throws InterruptedException {
        Version version = context.getVersion();
        List<ScenarioResult> results = new ArrayList<>(scenarios.size());

        for (Scenario scenario : scenarios) {
            if (!scenario.getGate().appliesTo(version)) {
                LOG.info("[{}] {} skipped: {}", version, scenario.getName(), scenario.getGate().getReason());
                results.add(ScenarioResult.skipped(scenario.getName(), scenario.getGate().getReason()));
                continue;
            }
            results.add(runScenario(scenario, context, version));
        }

        SuiteResult suiteResult = new SuiteResult(results);
        LOG.info("[{}] Suite finished: {}", version, suiteResult);
        return suiteResult;
    }

    private static ScenarioResult runScenario(Scenario scenario, ScenarioContext context, Version version)
            throws InterruptedException {
        long startedAt = System.nanoTime();
        try {
            scenario.getBody().run(context);
        } catch (InterruptedException e) {
            throw e;
        } catch (AssertionError e) {
            LOG.error("[{}] {} failed: {}", version, scenario.getName(), e.getMessage());
            return ScenarioResult.failed(scenario.getName(), e.getMessage(), since(startedAt));
        } catch (Exception e) {
            LOG.error("[{}] {} errored", version, scenario.getName(), e);
            return ScenarioResult.failed(scenario.getName(), e.getClass().getSimpleName() + ": " + e.getMessage(),
                    since(startedAt));
        }
        Duration duration = since(startedAt);
        LOG.info("[{}] {} passed in {} ms", version, scenario.getName(), duration.toMillis());
        return ScenarioResult.passed(scenario.getName(), duration);
    }

    private static Duration since(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt);
    }
}
