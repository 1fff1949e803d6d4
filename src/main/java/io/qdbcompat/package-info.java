/**
 * Cross-version compatibility harness for the QuestDB ILP client.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>{@link io.qdbcompat.version.VersionMatrix} resolves the versions to test from the release catalog</li>
 *   <li>{@link io.qdbcompat.run.CompatibilityRunner} installs and starts a
 *       {@link io.qdbcompat.fixture.Fixture} per version</li>
 *   <li>{@link io.qdbcompat.suite.BehaviorSuite} writes rows through the ILP client and reads them back over
 *       HTTP with {@link io.qdbcompat.query.ConsistencyCheck}</li>
 *   <li>{@link io.qdbcompat.run.RunReport} summarises the outcome and the exit status</li>
 * </ol>
 *
 * <h2>Configuration</h2>
 * Timeouts, the Docker image repository and the failure policies are read from
 * {@code questdb.compat.*} system properties, see {@link io.qdbcompat.config.HarnessSettings}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * java -jar questdb-ilp-compat.jar list -n 10
 * java -jar questdb-ilp-compat.jar run --versions 6.1.2 7.4.2 --continue-on-failure
 * }</pre>
 */
package io.qdbcompat;
