package uk.gegc.mcqgen.features.mcq.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mcqgen.features.mcq.domain.McqOption;
import uk.gegc.mcqgen.features.mcq.domain.McqRecord;

import java.util.LinkedHashMap;
import java.util.Map;

@Schema(description = "A generated multiple-choice question")
public record McqDto(
        @Schema(description = "Question text", example = "What is 2+2?")
        String question,
        @Schema(description = "Options keyed by label A-D", example = "{\"A\":\"3\",\"B\":\"4\",\"C\":\"5\",\"D\":\"6\"}")
        Map<String, String> options,
        @Schema(description = "Label of the correct option", example = "B")
        String correctAnswer
) {
    public static McqDto from(McqRecord record) {
        Map<String, String> options = new LinkedHashMap<>();
        for (McqOption option : record.options()) {
            options.put(option.label().name(), option.text());
        }
        return new McqDto(record.question(), options, record.correctLabel().name());
    }
}
