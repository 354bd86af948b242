package uk.gegc.mcqgen.features.generation.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.extraction.domain.ExtractedText;
import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.shared.config.McqGeneratorProperties;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Renders the MCQ instruction template for a document.
 * The template is read once at construction, so {@link #build} does no I/O.
 */
@Component
@Slf4j
public class McqPromptBuilder {

    static final String TEMPLATE_LOCATION = "classpath:prompts/mcq-generation.txt";

    private static final String CONTENT_PLACEHOLDER = "{content}";
    private static final String COUNT_PLACEHOLDER = "{questionCount}";

    private final String template;
    private final int maxContentChars;

    public McqPromptBuilder(ResourceLoader resourceLoader, McqGeneratorProperties properties) {
        this.template = loadTemplate(resourceLoader);
        this.maxContentChars = properties.generation().maxContentChars();
    }

    public GenerationRequest build(ExtractedText text, int questionCount) {
        if (text == null) {
            throw new IllegalArgumentException("Text cannot be null");
        }
        if (questionCount < 1) {
            throw new IllegalArgumentException("Question count must be at least 1");
        }

        String content = text.value();
        boolean truncated = content.length() > maxContentChars;
        if (truncated) {
            log.warn("Document text has {} characters; truncating to {} before prompting",
                    content.length(), maxContentChars);
            content = truncate(content, maxContentChars);
        }

        // Count first, so placeholder-like text inside the document is left alone
        String prompt = template
                .replace(COUNT_PLACEHOLDER, String.valueOf(questionCount))
                .replace(CONTENT_PLACEHOLDER, content);

        log.debug("Built prompt of {} characters for {} questions", prompt.length(), questionCount);
        return new GenerationRequest(content, questionCount, prompt, truncated);
    }

    private static String truncate(String content, int limit) {
        int end = limit;
        if (end > 1 && Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end);
    }

    private static String loadTemplate(ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(TEMPLATE_LOCATION);
        try (InputStream in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load prompt template: " + TEMPLATE_LOCATION, e);
        }
    }
}
