package uk.gegc.mcqgen.features.generation.domain;

/**
 * A single prompt ready to send to the generation service.
 *
 * @param content        the (possibly truncated) document text embedded in the prompt
 * @param requestedCount number of questions asked for, at least 1
 * @param prompt         the fully rendered instruction text
 * @param truncated      whether {@code content} was cut to the configured cap
 */
public record GenerationRequest(String content, int requestedCount, String prompt, boolean truncated) {

    public GenerationRequest {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content cannot be empty");
        }
        if (requestedCount < 1) {
            throw new IllegalArgumentException("Requested count must be at least 1");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt cannot be empty");
        }
    }
}
