package io.qdbcompat.version;

import java.util.Arrays;
import java.util.Objects;

/**
 * A dotted release version such as {@code 6.0.7.1} or {@code 7.4.2}.
 *
 * <p>Versions of different length compare as if the shorter one had trailing zeros, so
 * {@code 6.1.2} and {@code 6.1.2.0} are equal and {@code 6.0.7} sorts before {@code 6.0.7.1}.
 */
public final class Version implements Comparable<Version> {

    private final int[] components;

    private Version(int[] components) {
        this.components = components;
    }

    /**
     * Parses a version string. A leading {@code v} is accepted.
     *
     * @throws IllegalArgumentException if the text is not a dotted list of non-negative integers
     */
    public static Version parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (trimmed.startsWith("v") || trimmed.startsWith("V")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Not a version: '" + text + "'");
        }
        String[] parts = trimmed.split("\\.", -1);
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Not a version: '" + text + "'");
            }
            try {
                components[i] = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Version component out of range in '" + text + "'", e);
            }
        }
        return new Version(components);
    }

    public static Version of(int... components) {
        if (components.length == 0) {
            throw new IllegalArgumentException("A version needs at least one component");
        }
        for (int component : components) {
            if (component < 0) {
                throw new IllegalArgumentException("Negative version component: " + Arrays.toString(components));
            }
        }
        return new Version(components.clone());
    }

    public int[] getComponents() {
        return components.clone();
    }

    public boolean isAtMost(Version other) {
        return compareTo(other) <= 0;
    }

    public boolean isAtLeast(Version other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(Version other) {
        int length = Math.max(components.length, other.components.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(componentAt(i), other.componentAt(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    private int componentAt(int index) {
        return index < components.length ? components[index] : 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Version && compareTo((Version) o) == 0;
    }

    @Override
    public int hashCode() {
        // Trailing zeros must not change the hash.
        int significant = components.length;
        while (significant > 1 && components[significant - 1] == 0) {
            significant--;
        }
        return Arrays.hashCode(Arrays.copyOf(components, significant));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(components[i]);
        }
        return sb.toString();
    }
}
