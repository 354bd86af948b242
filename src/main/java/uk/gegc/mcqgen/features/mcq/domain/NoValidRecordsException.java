package uk.gegc.mcqgen.features.mcq.domain;

import uk.gegc.mcqgen.shared.exception.FailureType;
import uk.gegc.mcqgen.shared.exception.McqGenerationException;

public class NoValidRecordsException extends McqGenerationException {
    public NoValidRecordsException(String message) {
        super(message);
    }

    @Override
    public FailureType getFailureType() {
        return FailureType.NO_VALID_RECORDS;
    }
}
