package uk.gegc.mcqgen.features.artifact.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.artifact.application.ArtifactStore;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactFormat;
import uk.gegc.mcqgen.features.artifact.domain.ArtifactWriteException;
import uk.gegc.mcqgen.features.artifact.domain.OutputArtifacts;
import uk.gegc.mcqgen.features.artifact.domain.RenderedArtifact;
import uk.gegc.mcqgen.features.artifact.domain.StoredArtifacts;
import uk.gegc.mcqgen.shared.config.McqGeneratorProperties;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores artifacts as flat files in the results directory.
 * <p>
 * Each file is written to a temporary file next to its target and moved into
 * place. If the document fails after the transcript landed, the transcript is
 * removed again.
 */
@Component
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    private final Path resultsDir;

    public FileSystemArtifactStore(McqGeneratorProperties properties) {
        this.resultsDir = properties.storage().resultsPath().toAbsolutePath().normalize();
    }

    @Override
    public StoredArtifacts store(String sourceStem, OutputArtifacts artifacts) {
        if (sourceStem == null || sourceStem.isBlank()) {
            throw new IllegalArgumentException("Source stem cannot be null or blank");
        }

        Path transcriptPath = targetPath(sourceStem, ArtifactFormat.TRANSCRIPT);
        Path documentPath = targetPath(sourceStem, ArtifactFormat.DOCUMENT);

        try {
            Files.createDirectories(resultsDir);
        } catch (IOException e) {
            throw new ArtifactWriteException("Cannot create results directory " + resultsDir, e);
        }

        writeAtomically(transcriptPath, artifacts.transcript());
        try {
            writeAtomically(documentPath, artifacts.document());
        } catch (ArtifactWriteException e) {
            deleteQuietly(transcriptPath, e);
            throw e;
        }

        log.info("Stored artifacts {} and {}", transcriptPath.getFileName(), documentPath.getFileName());
        return new StoredArtifacts(transcriptPath, documentPath);
    }

    @Override
    public Optional<Path> find(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        Path candidate = resultsDir.resolve(filename).normalize();
        if (!candidate.startsWith(resultsDir) || !Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        return Optional.of(candidate);
    }

    static String filenameFor(String sourceStem, ArtifactFormat format) {
        return FILENAME_PREFIX + sourceStem + "." + format.getExtension();
    }

    private Path targetPath(String sourceStem, ArtifactFormat format) {
        Path target = resultsDir.resolve(filenameFor(sourceStem, format)).normalize();
        if (!target.getParent().equals(resultsDir)) {
            throw new IllegalArgumentException("Source stem must not contain path elements: " + sourceStem);
        }
        return target;
    }

    private void writeAtomically(Path target, RenderedArtifact artifact) {
        Path temp = null;
        try {
            temp = Files.createTempFile(resultsDir, ".tmp-", "." + artifact.format().getExtension());
            Files.write(temp, artifact.content());
            move(temp, target);
        } catch (IOException e) {
            if (temp != null) {
                deleteQuietly(temp, e);
            }
            throw new ArtifactWriteException("Failed to write " + target.getFileName(), e);
        }
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, falling back to replace", resultsDir);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path path, Exception primary) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
            log.warn("Could not remove {} after failed write", path, cleanup);
        }
    }
}
