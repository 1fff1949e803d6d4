/**
 * Test doubles shared by the unit tests.
 *
 * <ul>
 *   <li>{@link io.qdbcompat.testutil.TestConstants} - timeouts and canned {@code /exec} responses</li>
 *   <li>{@link io.qdbcompat.testutil.StubHttpServer} - scripted HTTP server on a loopback port, stands in for
 *       the QuestDB query endpoint and the GitHub releases API</li>
 *   <li>{@link io.qdbcompat.testutil.FakeFixture} - fixture state machine without Docker</li>
 *   <li>{@link io.qdbcompat.testutil.StubReleaseCatalog} - fixed list of release tags</li>
 * </ul>
 */
package io.qdbcompat.testutil;
