package uk.gegc.mcqgen.features.artifact.domain;

import java.util.Arrays;

/**
 * Rendered artifact bytes, not yet written anywhere.
 */
public record RenderedArtifact(ArtifactFormat format, byte[] content) {
    public RenderedArtifact {
        if (format == null) {
            throw new IllegalArgumentException("Artifact format cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("Artifact content cannot be null");
        }
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RenderedArtifact that)) {
            return false;
        }
        return format == that.format && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return 31 * format.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RenderedArtifact[format=" + format + ", size=" + content.length + "]";
    }
}
