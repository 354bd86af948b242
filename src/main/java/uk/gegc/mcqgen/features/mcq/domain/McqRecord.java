package uk.gegc.mcqgen.features.mcq.domain;

import java.util.List;

/**
 * A validated multiple-choice question.
 * <p>
 * Options are always exactly four, labelled A to D in label order. {@code blockText}
 * is the trimmed source block the record was parsed from and is what the
 * transcript reproduces.
 */
public record McqRecord(
        String question,
        List<McqOption> options,
        OptionLabel correctLabel,
        String blockText
) {
    public McqRecord {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question cannot be null or blank");
        }
        if (options == null || options.size() != OptionLabel.values().length) {
            throw new IllegalArgumentException("Exactly " + OptionLabel.values().length + " options are required");
        }
        options = List.copyOf(options);
        for (OptionLabel label : OptionLabel.values()) {
            if (options.get(label.ordinal()).label() != label) {
                throw new IllegalArgumentException("Options must be in label order A-D");
            }
        }
        if (correctLabel == null) {
            throw new IllegalArgumentException("Correct label cannot be null");
        }
        if (blockText == null || blockText.isBlank()) {
            throw new IllegalArgumentException("Block text cannot be null or blank");
        }
    }

    public McqOption option(OptionLabel label) {
        return options.get(label.ordinal());
    }

    public McqOption correctOption() {
        return option(correctLabel);
    }
}
