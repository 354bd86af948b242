package uk.gegc.mcqgen.features.mcq.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Result of generating MCQs from an uploaded document")
public record McqGenerationResponse(
        @Schema(description = "Sanitized name of the uploaded file", example = "lecture_notes.pdf")
        String sourceFilename,
        @Schema(description = "Number of questions requested", example = "5")
        int requestedCount,
        @Schema(description = "Number of valid questions generated", example = "5")
        int generatedCount,
        @Schema(description = "Number of malformed blocks dropped from the generation response", example = "0")
        int discardedBlocks,
        @Schema(description = "Generated questions in order")
        List<McqDto> questions,
        @Schema(description = "Download name of the plain-text transcript", example = "generated_mcqs_lecture_notes.txt")
        String transcriptFilename,
        @Schema(description = "Download name of the PDF document", example = "generated_mcqs_lecture_notes.pdf")
        String documentFilename
) {
}
