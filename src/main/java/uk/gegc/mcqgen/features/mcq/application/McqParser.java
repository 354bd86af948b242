package uk.gegc.mcqgen.features.mcq.application;

import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;

/**
 * Parser for turning a raw generation response into validated MCQ records.
 */
public interface McqParser {

    /**
     * Block delimiter used by the generation prompt.
     */
    String BLOCK_DELIMITER = "## MCQ";

    /**
     * Parse every well-formed block of the response.
     * <p>
     * Never fails: malformed blocks are dropped and counted, and an empty result
     * set is a valid outcome.
     *
     * @param rawResponse the raw text returned by the generation service
     * @return records in order of appearance
     */
    McqResultSet parse(String rawResponse);
}
