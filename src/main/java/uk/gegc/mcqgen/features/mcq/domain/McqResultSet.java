package uk.gegc.mcqgen.features.mcq.domain;

import java.util.List;

/**
 * Records parsed from one generation response, in order of appearance, plus how
 * many candidate blocks were dropped as malformed.
 */
public record McqResultSet(List<McqRecord> records, int discardedBlocks) {
    public McqResultSet {
        records = records == null ? List.of() : List.copyOf(records);
        if (discardedBlocks < 0) {
            throw new IllegalArgumentException("Discarded block count cannot be negative");
        }
    }

    public static McqResultSet empty() {
        return new McqResultSet(List.of(), 0);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
