package uk.gegc.mcqgen.features.generation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import uk.gegc.mcqgen.features.generation.application.GenerationClient;
import uk.gegc.mcqgen.features.generation.application.RetryPolicy;
import uk.gegc.mcqgen.features.generation.application.RetryingGenerationClient;
import uk.gegc.mcqgen.features.generation.infra.SpringAiGenerationClient;
import uk.gegc.mcqgen.shared.config.McqGeneratorProperties;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the generation client: a Spring AI base call, optionally wrapped in retries.
 */
@Configuration
@Slf4j
public class GenerationClientConfig {

    @Bean(name = "generationExecutor", destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor(McqGeneratorProperties properties) {
        int poolSize = properties.generation().executorPoolSize();
        log.info("Generation executor initialized with {} threads", poolSize);
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("mcq-generation-"));
    }

    @Bean
    public ChatClient chatClient(ChatClient.Builder builder) {
        return builder.build();
    }

    @Bean
    public GenerationClient generationClient(ChatClient chatClient,
                                             ExecutorService generationExecutor,
                                             McqGeneratorProperties properties) {
        GenerationClient client = new SpringAiGenerationClient(
                chatClient, generationExecutor, properties.generation().timeout());

        McqGeneratorProperties.Retry retry = properties.retry();
        if (!retry.enabled()) {
            return client;
        }
        log.info("Generation retries enabled: {} attempts, base delay {}, max delay {}",
                retry.maxAttempts(), retry.baseDelay(), retry.maxDelay());
        return new RetryingGenerationClient(client, RetryPolicy.from(retry));
    }
}
