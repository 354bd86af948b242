package uk.gegc.mcqgen.features.artifact.application;

import uk.gegc.mcqgen.features.artifact.domain.OutputArtifacts;
import uk.gegc.mcqgen.features.artifact.domain.StoredArtifacts;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists rendered artifacts and looks them up again for download.
 */
public interface ArtifactStore {

    String FILENAME_PREFIX = "generated_mcqs_";

    /**
     * Write both artifacts for the given source stem.
     * Either both files become visible or neither does.
     *
     * @throws uk.gegc.mcqgen.features.artifact.domain.ArtifactWriteException if writing fails
     */
    StoredArtifacts store(String sourceStem, OutputArtifacts artifacts);

    /**
     * Resolve a previously stored artifact by file name, if it exists.
     */
    Optional<Path> find(String filename);
}
