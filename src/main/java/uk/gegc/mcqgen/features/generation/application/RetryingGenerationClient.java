package uk.gegc.mcqgen.features.generation.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.mcqgen.features.generation.domain.GenerationException;
import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.features.generation.domain.RawGenerationResponse;

/**
 * Decorator that retries transient generation failures with exponential backoff.
 * Non-transient failures and empty responses are rethrown immediately.
 */
@Slf4j
public class RetryingGenerationClient implements GenerationClient {

    private final GenerationClient delegate;
    private final RetryPolicy policy;

    public RetryingGenerationClient(GenerationClient delegate, RetryPolicy policy) {
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public RawGenerationResponse generate(GenerationRequest request) {
        int attempt = 1;
        while (true) {
            try {
                return delegate.generate(request);
            } catch (GenerationException e) {
                if (!e.isTransient() || attempt >= policy.maxAttempts()) {
                    if (attempt > 1) {
                        log.error("Generation failed after {} attempt(s): {}", attempt, e.getMessage());
                    }
                    throw e;
                }
                long delayMs = policy.backoffMillis(attempt - 1);
                log.warn("Transient generation failure (attempt {}/{}): {}. Retrying in {} ms",
                        attempt, policy.maxAttempts(), e.getMessage(), delayMs);
                sleepBeforeRetry(delayMs);
                attempt++;
            }
        }
    }

    /**
     * Overridable so tests can skip the wait.
     */
    protected void sleepBeforeRetry(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new GenerationException("Interrupted while waiting to retry generation", ie);
        }
    }
}
