package uk.gegc.mcqgen.features.artifact.domain;

import java.nio.file.Path;

public record StoredArtifacts(Path transcriptPath, Path documentPath) {
    public StoredArtifacts {
        if (transcriptPath == null || documentPath == null) {
            throw new IllegalArgumentException("Both artifact paths are required");
        }
    }

    public String transcriptFilename() {
        return transcriptPath.getFileName().toString();
    }

    public String documentFilename() {
        return documentPath.getFileName().toString();
    }
}
