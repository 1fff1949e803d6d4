package io.qdbcompat.version;

import java.util.List;

/**
 * Source of released QuestDB versions.
 */
public interface ReleaseCatalog {

    /**
     * Lists the most recent releases, newest first.
     *
     * @param count maximum number of releases to return
     * @return at most {@code count} releases
     * @throws CatalogException if the catalog could not be read
     * @throws InterruptedException if interrupted while reading
     */
    List<ReleaseArtifact> latest(int count) throws InterruptedException;
}
