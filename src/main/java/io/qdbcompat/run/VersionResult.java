package io.qdbcompat.run;

import io.qdbcompat.suite.SuiteResult;
import io.qdbcompat.version.ReleaseArtifact;
import io.qdbcompat.version.Version;
import java.util.Objects;

/**
 * Outcome of the suite against one release.
 */
public final class VersionResult {

    private final ReleaseArtifact artifact;
    private final Version serverVersion;
    private final SuiteResult suiteResult;
    private final String error;

    private VersionResult(ReleaseArtifact artifact, Version serverVersion, SuiteResult suiteResult, String error) {
        this.artifact = Objects.requireNonNull(artifact, "artifact");
        this.serverVersion = serverVersion;
        this.suiteResult = suiteResult;
        this.error = error;
    }

    public static VersionResult completed(ReleaseArtifact artifact, Version serverVersion, SuiteResult suiteResult) {
        return new VersionResult(artifact, serverVersion, Objects.requireNonNull(suiteResult, "suiteResult"), null);
    }

    public static VersionResult errored(ReleaseArtifact artifact, Version serverVersion, String error) {
        return new VersionResult(artifact, serverVersion, null, Objects.requireNonNull(error, "error"));
    }

    public ReleaseArtifact getArtifact() {
        return artifact;
    }

    /**
     * Gets the version the server reported, or {@code null} if it never started.
     */
    public Version getServerVersion() {
        return serverVersion;
    }

    /**
     * Gets the suite outcome, or {@code null} if the suite could not run.
     */
    public SuiteResult getSuiteResult() {
        return suiteResult;
    }

    /**
     * Gets the error that prevented the suite from completing, or {@code null}.
     */
    public String getError() {
        return error;
    }

    public boolean passed() {
        return error == null && suiteResult.wasSuccessful();
    }

    @Override
    public String toString() {
        String label = artifact.getTag() + (serverVersion == null ? "" : " (server " + serverVersion + ")");
        if (error != null) {
            return label + ": ERROR " + error;
        }
        return label + ": " + (passed() ? "PASSED" : "FAILED") + " [" + suiteResult + "]";
    }
}
