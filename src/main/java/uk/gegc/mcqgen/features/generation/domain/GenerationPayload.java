package uk.gegc.mcqgen.features.generation.domain;

import java.util.List;
import java.util.Objects;

/**
 * The two shapes a generation service reply can take.
 * Resolved to plain text once, at the client boundary.
 */
public interface GenerationPayload {

    /**
     * @return the payload text, possibly empty
     */
    String text();

    /**
     * A reply carrying one aggregated text field.
     */
    record AggregatedText(String value) implements GenerationPayload {

        @Override
        public String text() {
            return value == null ? "" : value;
        }
    }

    /**
     * A reply split into ordered content fragments, joined with newlines.
     */
    record Fragments(List<String> parts) implements GenerationPayload {

        public Fragments {
            parts = parts == null ? List.of() : parts.stream().filter(Objects::nonNull).toList();
        }

        @Override
        public String text() {
            return String.join("\n", parts);
        }
    }
}
