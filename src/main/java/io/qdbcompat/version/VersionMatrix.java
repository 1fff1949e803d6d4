package io.qdbcompat.version;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link VersionSelector} into the ordered set of releases to test.
 *
 * <p>Explicit versions are looked up among a fixed, wider window of recent releases rather than
 * the whole catalog, so versions older than that window are reported as unknown.
 */
public final class VersionMatrix {

    private static final Logger LOG = LoggerFactory.getLogger(VersionMatrix.class);

    private final ReleaseCatalog catalog;
    private final int explicitWindow;

    public VersionMatrix(ReleaseCatalog catalog, int explicitWindow) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        if (explicitWindow < 1) {
            throw new IllegalArgumentException("Explicit version window must be at least 1: " + explicitWindow);
        }
        this.explicitWindow = explicitWindow;
    }

    /**
     * Resolves the selector.
     *
     * @return releases keyed by version; newest first for "last N", request order for explicit lists
     * @throws UnknownVersionException if an explicit version is not in the catalog window
     * @throws CatalogException if the catalog could not be read
     * @throws InterruptedException if interrupted while reading the catalog
     */
    public Map<Version, ReleaseArtifact> resolve(VersionSelector selector) throws InterruptedException {
        Objects.requireNonNull(selector, "selector");
        Map<Version, ReleaseArtifact> matrix = new LinkedHashMap<>();

        if (!selector.isExplicit()) {
            for (ReleaseArtifact artifact : catalog.latest(selector.getLastN())) {
                matrix.putIfAbsent(artifact.getVersion(), artifact);
            }
            LOG.info("Resolved {} to {}", selector, matrix.keySet());
            return matrix;
        }

        Map<Version, ReleaseArtifact> known = new LinkedHashMap<>();
        for (ReleaseArtifact artifact : catalog.latest(explicitWindow)) {
            known.putIfAbsent(artifact.getVersion(), artifact);
        }
        List<Version> missing = new ArrayList<>();
        for (Version version : selector.getVersions()) {
            ReleaseArtifact artifact = known.get(version);
            if (artifact == null) {
                missing.add(version);
            } else {
                matrix.put(version, artifact);
            }
        }
        if (!missing.isEmpty()) {
            throw new UnknownVersionException(missing, explicitWindow);
        }
        LOG.info("Resolved {} to {}", selector, matrix.values());
        return matrix;
    }
}
