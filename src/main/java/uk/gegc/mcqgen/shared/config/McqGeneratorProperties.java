package uk.gegc.mcqgen.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Process-wide settings for MCQ generation, bound once at startup from {@code app.mcq.*}.
 */
@Validated
@ConfigurationProperties(prefix = "app.mcq")
public record McqGeneratorProperties(
        @Valid @NotNull @DefaultValue Storage storage,
        @Valid @NotNull @DefaultValue Generation generation,
        @Valid @NotNull @DefaultValue Retry retry
) {

    public static McqGeneratorProperties defaults() {
        return new McqGeneratorProperties(Storage.defaults(), Generation.defaults(), Retry.defaults());
    }

    /**
     * @param uploadDir         directory uploaded source documents are saved to
     * @param resultsDir        directory generated transcripts and PDFs are written to
     * @param allowedExtensions file extensions accepted for upload, without the dot
     */
    public record Storage(
            @NotBlank @DefaultValue("uploads") String uploadDir,
            @NotBlank @DefaultValue("results") String resultsDir,
            @NotEmpty @DefaultValue({"pdf", "txt", "docx"}) List<String> allowedExtensions
    ) {

        public Storage {
            allowedExtensions = allowedExtensions == null ? List.of() : allowedExtensions.stream()
                    .map(ext -> ext.toLowerCase(Locale.ROOT))
                    .toList();
        }

        public static Storage defaults() {
            return new Storage("uploads", "results", List.of("pdf", "txt", "docx"));
        }

        public Path uploadPath() {
            return Path.of(uploadDir);
        }

        public Path resultsPath() {
            return Path.of(resultsDir);
        }

        public boolean isAllowedExtension(String extension) {
            return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * @param maxContentChars  extracted text longer than this is truncated before prompting
     * @param timeout          upper bound for one call to the generation service
     * @param maxQuestions     largest question count the upload API accepts
     * @param executorPoolSize threads available for outbound generation calls
     */
    public record Generation(
            @Min(1) @DefaultValue("30000") int maxContentChars,
            @NotNull @DefaultValue("120s") Duration timeout,
            @Min(1) @DefaultValue("50") int maxQuestions,
            @Min(1) @DefaultValue("4") int executorPoolSize
    ) {

        public static Generation defaults() {
            return new Generation(30000, Duration.ofSeconds(120), 50, 4);
        }
    }

    /**
     * Backoff policy for transient generation failures. Off unless enabled.
     */
    public record Retry(
            @DefaultValue("false") boolean enabled,
            @Min(1) @DefaultValue("3") int maxAttempts,
            @NotNull @DefaultValue("1s") Duration baseDelay,
            @NotNull @DefaultValue("60s") Duration maxDelay,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.25") double jitterFactor
    ) {

        public static Retry defaults() {
            return new Retry(false, 3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.25);
        }
    }
}
