package uk.gegc.mcqgen.features.artifact.domain;

import java.nio.charset.StandardCharsets;

/**
 * Transcript and document rendered from one result set.
 */
public record OutputArtifacts(RenderedArtifact transcript, RenderedArtifact document) {
    public OutputArtifacts {
        if (transcript == null || transcript.format() != ArtifactFormat.TRANSCRIPT) {
            throw new IllegalArgumentException("A transcript artifact is required");
        }
        if (document == null || document.format() != ArtifactFormat.DOCUMENT) {
            throw new IllegalArgumentException("A document artifact is required");
        }
    }

    public String transcriptText() {
        return new String(transcript.content(), StandardCharsets.UTF_8);
    }
}
