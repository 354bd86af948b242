package uk.gegc.mcqgen.features.artifact.domain;

import java.nio.file.Path;

/**
 * A stored artifact resolved for download.
 */
public record ArtifactDownload(String filename, String contentType, Path path) {
    public ArtifactDownload {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }
    }
}
