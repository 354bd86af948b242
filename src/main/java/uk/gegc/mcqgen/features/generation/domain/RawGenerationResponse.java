package uk.gegc.mcqgen.features.generation.domain;

/**
 * Unparsed text returned by the generation service. Never blank.
 */
public record RawGenerationResponse(String text) {

    public RawGenerationResponse {
        if (text == null || text.isBlank()) {
            throw new EmptyResponseException("Generation service returned no text");
        }
    }
}
