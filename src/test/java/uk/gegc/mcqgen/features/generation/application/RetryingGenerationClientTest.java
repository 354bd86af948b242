package uk.gegc.mcqgen.features.generation.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.mcqgen.features.generation.domain.EmptyResponseException;
import uk.gegc.mcqgen.features.generation.domain.GenerationException;
import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.features.generation.domain.RawGenerationResponse;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetryingGenerationClient")
class RetryingGenerationClientTest {

    private static final GenerationRequest REQUEST = new GenerationRequest("content", 3, "prompt", false);

    @Mock
    private GenerationClient delegate;

    private final List<Long> sleeps = new ArrayList<>();
    private RetryingGenerationClient client;

    @BeforeEach
    void setUp() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(1000), 0.0);
        client = new RetryingGenerationClient(delegate, policy) {
            @Override
            protected void sleepBeforeRetry(long delayMs) {
                sleeps.add(delayMs);
            }
        };
    }

    @Nested
    @DisplayName("Retry decisions")
    class RetryDecisions {

        @Test
        void success_firstAttempt_noRetry() {
            RawGenerationResponse response = new RawGenerationResponse("## MCQ ...");
            when(delegate.generate(REQUEST)).thenReturn(response);

            assertThat(client.generate(REQUEST)).isEqualTo(response);
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("transient failures are retried with exponential backoff")
        void transientFailure_thenSuccess_retries() {
            RawGenerationResponse response = new RawGenerationResponse("## MCQ ...");
            when(delegate.generate(REQUEST))
                    .thenThrow(GenerationException.transientFailure("429 Too Many Requests", null))
                    .thenThrow(GenerationException.transientFailure("503 UNAVAILABLE", null))
                    .thenReturn(response);

            assertThat(client.generate(REQUEST)).isEqualTo(response);
            assertThat(sleeps).containsExactly(100L, 200L);
            verify(delegate, times(3)).generate(REQUEST);
        }

        @Test
        void transientFailure_exhaustsAttempts_rethrowsLast() {
            when(delegate.generate(REQUEST))
                    .thenThrow(GenerationException.transientFailure("429 first", null))
                    .thenThrow(GenerationException.transientFailure("429 second", null))
                    .thenThrow(GenerationException.transientFailure("429 third", null));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOf(GenerationException.class)
                    .hasMessage("429 third");
            verify(delegate, times(3)).generate(REQUEST);
            assertThat(sleeps).hasSize(2);
        }

        @Test
        void nonTransientFailure_isNotRetried() {
            when(delegate.generate(REQUEST)).thenThrow(new GenerationException("401 invalid api key"));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOf(GenerationException.class)
                    .hasMessageContaining("401");
            verify(delegate, times(1)).generate(REQUEST);
            assertThat(sleeps).isEmpty();
        }

        @Test
        void emptyResponse_isNotRetried() {
            when(delegate.generate(REQUEST)).thenThrow(new EmptyResponseException("no text"));

            assertThatThrownBy(() -> client.generate(REQUEST)).isInstanceOf(EmptyResponseException.class);
            verify(delegate, times(1)).generate(REQUEST);
        }

        @Test
        void timeout_isRetriedAndKeepsTimeoutFlag() {
            when(delegate.generate(REQUEST)).thenThrow(GenerationException.timedOut("timed out", null));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOfSatisfying(GenerationException.class, e -> assertThat(e.isTimeout()).isTrue());
            verify(delegate, times(3)).generate(REQUEST);
        }
    }

    @Nested
    @DisplayName("RetryPolicy")
    class Policy {

        @Test
        void backoff_isCappedAtMaxDelay() {
            RetryPolicy policy = new RetryPolicy(10, Duration.ofSeconds(1), Duration.ofSeconds(5), 0.0);

            assertThat(policy.backoffMillis(0)).isEqualTo(1000);
            assertThat(policy.backoffMillis(1)).isEqualTo(2000);
            assertThat(policy.backoffMillis(2)).isEqualTo(4000);
            assertThat(policy.backoffMillis(3)).isEqualTo(5000);
        }

        @Test
        void backoff_jitterStaysWithinRange() {
            RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(60), 0.25);

            for (int i = 0; i < 50; i++) {
                assertThat(policy.backoffMillis(0)).isBetween(750L, 1250L);
            }
        }

        @Test
        void invalidSettings_areRejected() {
            assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 0.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(2), Duration.ofSeconds(1), 0.0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
