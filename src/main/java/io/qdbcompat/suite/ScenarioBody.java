package io.qdbcompat.suite;

/**
 * The steps of a scenario: write rows, wait for them, assert on the result.
 */
@FunctionalInterface
public interface ScenarioBody {

    void run(ScenarioContext context) throws Exception;
}
