package io.qdbcompat.version;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Which releases to test: the latest N, or an explicit list of versions.
 */
public final class VersionSelector {

    private final int lastN;
    private final List<Version> versions;

    private VersionSelector(int lastN, List<Version> versions) {
        this.lastN = lastN;
        this.versions = versions;
    }

    public static VersionSelector lastN(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("Number of releases must be at least 1: " + count);
        }
        return new VersionSelector(count, List.of());
    }

    /**
     * Selects the given versions, in order. Duplicates are ignored.
     *
     * @throws IllegalArgumentException if the list is empty or an entry is not a version
     */
    public static VersionSelector explicit(List<String> versions) {
        Objects.requireNonNull(versions, "versions");
        if (versions.isEmpty()) {
            throw new IllegalArgumentException("At least one version is required");
        }
        List<Version> parsed = new ArrayList<>(versions.size());
        for (String text : versions) {
            Version version = Version.parse(text);
            if (!parsed.contains(version)) {
                parsed.add(version);
            }
        }
        return new VersionSelector(0, List.copyOf(parsed));
    }

    public boolean isExplicit() {
        return !versions.isEmpty();
    }

    public int getLastN() {
        return lastN;
    }

    public List<Version> getVersions() {
        return versions;
    }

    @Override
    public String toString() {
        return isExplicit() ? "versions " + versions : "last " + lastN + " releases";
    }
}
