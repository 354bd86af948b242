package uk.gegc.mcqgen.features.extraction.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Document formats the extractor understands, keyed by file extension.
 */
public enum SourceFormat {
    TEXT("txt", List.of("text/plain")),
    PDF("pdf", List.of("application/pdf")),
    DOCX("docx", List.of(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
            "application/x-tika-ooxml",
            "application/zip"));

    private final String extension;
    private final List<String> signatureMimeTypes;

    SourceFormat(String extension, List<String> signatureMimeTypes) {
        this.extension = extension;
        this.signatureMimeTypes = signatureMimeTypes;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * MIME types a content sniffer may report for a genuine file of this format.
     */
    public List<String> getSignatureMimeTypes() {
        return signatureMimeTypes;
    }

    public static Optional<SourceFormat> fromExtension(String extension) {
        if (extension == null) {
            return Optional.empty();
        }
        String normalized = extension.toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        String candidate = normalized;
        return Arrays.stream(values())
                .filter(format -> format.extension.equals(candidate))
                .findFirst();
    }

    public static Optional<SourceFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return Optional.empty();
        }
        return fromExtension(filename.substring(dot + 1));
    }
}
