package uk.gegc.mcqgen.features.extraction.domain;

/**
 * Normalized document content. Never blank.
 */
public record ExtractedText(String value) {

    public ExtractedText {
        if (value == null || value.isBlank()) {
            throw new EmptyContentException("Extracted text cannot be empty");
        }
        value = value.strip();
    }

    public int length() {
        return value.length();
    }
}
