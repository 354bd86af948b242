package uk.gegc.mcqgen.features.generation.application;

import uk.gegc.mcqgen.shared.config.McqGeneratorProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff with jitter.
 *
 * @param maxAttempts  total attempts including the first, at least 1
 * @param baseDelay    delay before the second attempt, doubled for each later one
 * @param maxDelay     cap on any single delay
 * @param jitterFactor 0.0 = no jitter, 0.25 = ±25% variation
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFactor) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay must be zero or positive");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay must not be shorter than base delay");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 1.0");
        }
    }

    public static RetryPolicy from(McqGeneratorProperties.Retry retry) {
        return new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.maxDelay(), retry.jitterFactor());
    }

    /**
     * Delay before the attempt following {@code retryCount} failed retries (0-based).
     */
    public long backoffMillis(int retryCount) {
        long exponentialDelay = baseDelay.toMillis() * (long) Math.pow(2, retryCount);
        double jitter = (1.0 - jitterFactor) + (Math.random() * 2 * jitterFactor);
        long delayWithJitter = (long) (exponentialDelay * jitter);
        return Math.min(delayWithJitter, maxDelay.toMillis());
    }
}
