package uk.gegc.mcqgen.features.mcq.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.mcqgen.features.artifact.application.ArtifactStore;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactDownload;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactNotFoundException;
import uk.gegc.mcqgen.features.extraction.domain.SourceFormat;
import uk.gegc.mcqgen.features.extraction.domain.UnsupportedFormatException;
import uk.gegc.mcqgen.features.mcq.api.dto.McqDto;
import uk.gegc.mcqgen.features.mcq.api.dto.McqGenerationResponse;
import uk.gegc.mcqgen.features.mcq.application.McqUploadService;
import uk.gegc.mcqgen.features.mcq.domain.InvalidUploadException;
import uk.gegc.mcqgen.features.mcq.domain.McqResultSet;
import uk.gegc.mcqgen.features.mcq.domain.UploadStorageException;
import uk.gegc.mcqgen.features.pipeline.application.McqGenerationPipeline;
import uk.gegc.mcqgen.features.pipeline.domain.McqGenerationFailedException;
import uk.gegc.mcqgen.features.pipeline.domain.PipelineResult;
import uk.gegc.mcqgen.shared.config.McqGeneratorProperties;
import uk.gegc.mcqgen.shared.util.FilenameSanitizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
@Service
@RequiredArgsConstructor
public class McqUploadServiceImpl implements McqUploadService {

    private static final String FALLBACK_CONTENT_TYPE = "application/octet-stream";

    private final McqGenerationPipeline pipeline;
    private final ArtifactStore artifactStore;
    private final McqGeneratorProperties properties;

    @Override
    public McqGenerationResponse generate(MultipartFile file, int numQuestions) {
        if (file == null || file.isEmpty()) {
            throw new InvalidUploadException("No file uploaded or file is empty");
        }

        String filename = sanitize(file.getOriginalFilename());
        String extension = FilenameSanitizer.extension(filename);
        McqGeneratorProperties.Storage storage = properties.storage();
        if (!storage.isAllowedExtension(extension)) {
            throw new InvalidUploadException("File type '" + extension + "' is not allowed. Allowed types: "
                    + String.join(", ", storage.allowedExtensions()));
        }

        int maxQuestions = properties.generation().maxQuestions();
        if (numQuestions < 1 || numQuestions > maxQuestions) {
            throw new InvalidUploadException("numQuestions must be between 1 and " + maxQuestions);
        }

        SourceFormat format = SourceFormat.fromExtension(extension)
                .orElseThrow(() -> new UnsupportedFormatException("No extractor available for '." + extension + "' files"));

        Path saved = save(file, filename);
        PipelineResult result = pipeline.run(saved, format, numQuestions);
        if (!result.isSuccess()) {
            throw new McqGenerationFailedException(result.failure());
        }

        McqResultSet resultSet = result.resultSet();
        return new McqGenerationResponse(
                filename,
                numQuestions,
                resultSet.size(),
                resultSet.discardedBlocks(),
                resultSet.records().stream().map(McqDto::from).toList(),
                result.artifacts().transcriptFilename(),
                result.artifacts().documentFilename()
        );
    }

    @Override
    public ArtifactDownload resolveDownload(String filename) {
        String safeName;
        try {
            safeName = FilenameSanitizer.sanitize(filename);
        } catch (IllegalArgumentException e) {
            throw new ArtifactNotFoundException("Artifact not found: " + filename);
        }

        Path path = artifactStore.find(safeName)
                .orElseThrow(() -> new ArtifactNotFoundException("Artifact not found: " + safeName));
        String contentType = ArtifactFormat.fromFilename(safeName)
                .map(ArtifactFormat::getContentType)
                .orElse(FALLBACK_CONTENT_TYPE);
        return new ArtifactDownload(safeName, contentType, path);
    }

    private String sanitize(String originalFilename) {
        try {
            return FilenameSanitizer.sanitize(originalFilename);
        } catch (IllegalArgumentException e) {
            throw new InvalidUploadException("Invalid file name: " + e.getMessage(), e);
        }
    }

    private Path save(MultipartFile file, String filename) {
        Path uploadDir = properties.storage().uploadPath().toAbsolutePath().normalize();
        Path target = uploadDir.resolve(filename);
        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(uploadDir);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UploadStorageException("Failed to save upload " + filename, e);
        }
        log.info("Saved upload {} ({} bytes)", filename, file.getSize());
        return target;
    }
}
