package uk.gegc.mcqgen.features.mcq.domain;

import java.util.Optional;

/**
 * Labels of the four answer options, in presentation order.
 */
public enum OptionLabel {
    A, B, C, D;

    /**
     * Line prefix introducing this option in a generated block, e.g. {@code "B)"}.
     */
    public String prefix() {
        return name() + ")";
    }

    public static Optional<OptionLabel> fromLetter(char letter) {
        return switch (Character.toUpperCase(letter)) {
            case 'A' -> Optional.of(A);
            case 'B' -> Optional.of(B);
            case 'C' -> Optional.of(C);
            case 'D' -> Optional.of(D);
            default -> Optional.empty();
        };
    }
}
