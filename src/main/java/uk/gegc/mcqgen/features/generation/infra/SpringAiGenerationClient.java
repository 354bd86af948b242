package uk.gegc.mcqgen.features.generation.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import uk.gegc.mcqgen.features.generation.application.GenerationClient;
import uk.gegc.mcqgen.features.generation.domain.EmptyResponseException;
import uk.gegc.mcqgen.features.generation.domain.GenerationException;
import uk.gegc.mcqgen.features.generation.domain.GenerationPayload;
import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.features.generation.domain.RawGenerationResponse;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Spring AI implementation of {@link GenerationClient}.
 * <p>
 * Makes one {@link ChatClient} call per request on a dedicated executor so the
 * wait can be bounded. No retries happen here; wrap with
 * {@link uk.gegc.mcqgen.features.generation.application.RetryingGenerationClient} for that.
 */
@Slf4j
public class SpringAiGenerationClient implements GenerationClient {

    private static final int LOG_PREVIEW_CHARS = 500;

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final Duration timeout;

    public SpringAiGenerationClient(ChatClient chatClient, ExecutorService executor, Duration timeout) {
        this.chatClient = chatClient;
        this.executor = executor;
        this.timeout = timeout;
    }

    @Override
    public RawGenerationResponse generate(GenerationRequest request) {
        log.info("Requesting {} MCQs from generation service ({} prompt characters)",
                request.requestedCount(), request.prompt().length());

        ChatResponse response = callWithTimeout(request.prompt());

        String text = resolvePayload(response).text();
        if (text.isBlank()) {
            throw new EmptyResponseException("Generation service returned no text");
        }

        log.info("Generation service returned {} characters", text.length());
        log.debug("Generation response preview: {}", text.substring(0, Math.min(LOG_PREVIEW_CHARS, text.length())));
        return new RawGenerationResponse(text);
    }

    /**
     * Picks the aggregated text if the reply has one, otherwise the ordered fragments.
     */
    static GenerationPayload resolvePayload(ChatResponse response) {
        if (response == null) {
            return new GenerationPayload.Fragments(List.of());
        }

        Generation result = response.getResult();
        if (result != null && result.getOutput() != null) {
            String aggregated = result.getOutput().getText();
            if (aggregated != null && !aggregated.isBlank()) {
                return new GenerationPayload.AggregatedText(aggregated);
            }
        }

        List<Generation> generations = response.getResults() == null ? List.of() : response.getResults();
        List<String> fragments = generations.stream()
                .filter(Objects::nonNull)
                .map(Generation::getOutput)
                .filter(Objects::nonNull)
                .map(AssistantMessage::getText)
                .filter(text -> text != null && !text.isBlank())
                .toList();
        return new GenerationPayload.Fragments(fragments);
    }

    private ChatResponse callWithTimeout(String prompt) {
        Future<ChatResponse> future;
        try {
            future = executor.submit(() -> chatClient.prompt()
                    .user(prompt)
                    .call()
                    .chatResponse());
        } catch (RejectedExecutionException e) {
            throw GenerationException.transientFailure("Generation executor is saturated", e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Generation service did not respond within {} ms", timeout.toMillis());
            throw GenerationException.timedOut(
                    "Generation service did not respond within " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting for generation service", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw classify(cause);
        }
    }

    private GenerationException classify(Throwable cause) {
        if (cause instanceof GenerationException generationException) {
            return generationException;
        }
        String detail = "Generation service call failed: " + cause.getMessage();

        if (cause instanceof ResourceAccessException && cause.getCause() instanceof SocketTimeoutException) {
            return GenerationException.timedOut(detail, cause);
        }
        if (cause instanceof TransientAiException
                || cause instanceof ResourceAccessException
                || isRateLimitOrUnavailable(cause)) {
            return GenerationException.transientFailure(detail, cause);
        }
        return new GenerationException(detail, cause);
    }

    private boolean isRateLimitOrUnavailable(Throwable cause) {
        String message = cause.getMessage();
        if (message == null) {
            return false;
        }
        return message.contains("429")
                || message.contains("rate limit")
                || message.contains("rate_limit_exceeded")
                || message.contains("Too Many Requests")
                || message.contains("RESOURCE_EXHAUSTED")
                || message.contains("503")
                || message.contains("UNAVAILABLE");
    }
}
