package io.qdbcompat.version;

import java.util.Objects;
import org.testcontainers.utility.DockerImageName;

/**
 * An installable QuestDB release: its tag, parsed version and the Docker image that packages it.
 */
public final class ReleaseArtifact {

    private final String tag;
    private final Version version;
    private final DockerImageName image;

    public ReleaseArtifact(String tag, Version version, DockerImageName image) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.version = Objects.requireNonNull(version, "version");
        this.image = Objects.requireNonNull(image, "image");
    }

    /**
     * Creates the artifact for a release tag in the given image repository.
     */
    public static ReleaseArtifact forTag(String imageRepository, String tag) {
        return new ReleaseArtifact(tag, Version.parse(tag), DockerImageName.parse(imageRepository).withTag(tag));
    }

    public String getTag() {
        return tag;
    }

    public Version getVersion() {
        return version;
    }

    public DockerImageName getImage() {
        return image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReleaseArtifact)) {
            return false;
        }
        ReleaseArtifact other = (ReleaseArtifact) o;
        return tag.equals(other.tag) && image.asCanonicalNameString().equals(other.image.asCanonicalNameString());
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, image.asCanonicalNameString());
    }

    @Override
    public String toString() {
        return image.asCanonicalNameString();
    }
}
