package io.qdbcompat.version;

import java.util.List;

/**
 * One or more requested versions are not in the release catalog window.
 */
public class UnknownVersionException extends RuntimeException {

    private final List<Version> missing;

    public UnknownVersionException(List<Version> missing, int window) {
        super("Unknown version(s) " + missing + ": not among the latest " + window + " releases");
        this.missing = List.copyOf(missing);
    }

    public List<Version> getMissing() {
        return missing;
    }
}
