package uk.gegc.mcqgen.features.mcq.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactDownload;
import uk.gegc.mcqgen.features.mcq.api.dto.McqGenerationResponse;

public interface McqUploadService {

    /**
     * Validate and save the upload, then run MCQ generation on it.
     *
     * @throws uk.gegc.mcqgen.features.mcq.domain.InvalidUploadException if the file or count is rejected
     * @throws uk.gegc.mcqgen.features.pipeline.domain.McqGenerationFailedException if generation fails
     */
    McqGenerationResponse generate(MultipartFile file, int numQuestions);

    /**
     * @throws uk.gegc.mcqgen.features.artifact.domain.ArtifactNotFoundException if no such artifact exists
     */
    ArtifactDownload resolveDownload(String filename);
}
