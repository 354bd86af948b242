package uk.gegc.mcqgen.features.mcq.domain;

public record McqOption(OptionLabel label, String text) {
    public McqOption {
        if (label == null) {
            throw new IllegalArgumentException("Option label cannot be null");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Option " + label + " text cannot be null or blank");
        }
    }
}
