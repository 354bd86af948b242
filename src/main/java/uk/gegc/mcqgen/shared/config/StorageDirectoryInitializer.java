package uk.gegc.mcqgen.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates the upload and results directories on startup. Startup fails if either cannot be created.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageDirectoryInitializer implements CommandLineRunner {

    private final McqGeneratorProperties properties;

    @Override
    public void run(String... args) {
        McqGeneratorProperties.Storage storage = properties.storage();
        ensureDirectory(storage.uploadPath());
        ensureDirectory(storage.resultsPath());
    }

    void ensureDirectory(Path directory) {
        Path absolute = directory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(absolute);
            log.info("Storage directory ready: {}", absolute);
        } catch (IOException e) {
            log.error("Cannot create storage directory {}: {}", absolute, e.getMessage());
            throw new UncheckedIOException("Cannot create storage directory " + absolute, e);
        }
    }
}
