package uk.gegc.mcqgen.features.artifact.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The two artifacts produced for every successful run.
 */
public enum ArtifactFormat {
    TRANSCRIPT("txt", "text/plain"),
    DOCUMENT("pdf", "application/pdf");

    private final String extension;
    private final String contentType;

    ArtifactFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String getExtension() {
        return extension;
    }

    public String getContentType() {
        return contentType;
    }

    public static Optional<ArtifactFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(format -> lower.endsWith("." + format.extension))
                .findFirst();
    }
}
