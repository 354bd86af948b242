package uk.gegc.mcqgen.features.generation.application;

import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.features.generation.domain.RawGenerationResponse;

/**
 * Sends one prompt to a text-generation service.
 * <p>
 * Implementations never leak vendor exceptions: every failure surfaces as a
 * {@link uk.gegc.mcqgen.features.generation.domain.GenerationException} or
 * {@link uk.gegc.mcqgen.features.generation.domain.EmptyResponseException}.
 */
public interface GenerationClient {

    RawGenerationResponse generate(GenerationRequest request);
}
