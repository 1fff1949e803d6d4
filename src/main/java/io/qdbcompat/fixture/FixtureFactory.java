package io.qdbcompat.fixture;

import io.qdbcompat.version.ReleaseArtifact;

/**
 * Creates a fresh, uninstalled fixture for a release.
 */
@FunctionalInterface
public interface FixtureFactory {

    Fixture create(ReleaseArtifact artifact);
}
