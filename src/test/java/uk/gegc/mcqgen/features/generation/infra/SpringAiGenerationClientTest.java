package uk.gegc.mcqgen.features.generation.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import uk.gegc.mcqgen.features.generation.domain.EmptyResponseException;
import uk.gegc.mcqgen.features.generation.domain.GenerationException;
import uk.gegc.mcqgen.features.generation.domain.GenerationPayload;
import uk.gegc.mcqgen.features.generation.domain.GenerationRequest;
import uk.gegc.mcqgen.features.generation.domain.RawGenerationResponse;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpringAiGenerationClient")
class SpringAiGenerationClientTest {

    private static final GenerationRequest REQUEST =
            new GenerationRequest("Photosynthesis text", 2, "Generate 2 MCQs from: Photosynthesis text", false);

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callResponseSpec;

    private ExecutorService executor;
    private SpringAiGenerationClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        client = new SpringAiGenerationClient(chatClient, executor, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void stubCallChain() {
        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponseSpec);
    }

    private static ChatResponse responseOf(String... texts) {
        List<Generation> generations = Arrays.stream(texts)
                .map(text -> new Generation(new AssistantMessage(text)))
                .toList();
        return new ChatResponse(generations);
    }

    @Nested
    @DisplayName("Successful calls")
    class Success {

        @Test
        void aggregatedText_isReturned() {
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenReturn(responseOf("## MCQ\nQuestion: Q?"));

            RawGenerationResponse response = client.generate(REQUEST);

            assertThat(response.text()).isEqualTo("## MCQ\nQuestion: Q?");
            verify(requestSpec).user(REQUEST.prompt());
        }

        @Test
        @DisplayName("fragments are joined with newlines when the first result is blank")
        void blankAggregate_fallsBackToFragments() {
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenReturn(responseOf("", "## MCQ part one", "part two"));

            assertThat(client.generate(REQUEST).text()).isEqualTo("## MCQ part one\npart two");
        }
    }

    @Nested
    @DisplayName("Response shape resolution")
    class PayloadResolution {

        @Test
        void aggregatedTextPreferred() {
            GenerationPayload payload = SpringAiGenerationClient.resolvePayload(responseOf("first", "second"));

            assertThat(payload).isInstanceOf(GenerationPayload.AggregatedText.class);
            assertThat(payload.text()).isEqualTo("first");
        }

        @Test
        void nullResponse_isEmptyFragments() {
            GenerationPayload payload = SpringAiGenerationClient.resolvePayload(null);

            assertThat(payload.text()).isEmpty();
        }

        @Test
        void noGenerations_isEmptyFragments() {
            GenerationPayload payload = SpringAiGenerationClient.resolvePayload(new ChatResponse(List.of()));

            assertThat(payload.text()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        void emptyResponse_throwsEmptyResponseException() {
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenReturn(responseOf("  ", ""));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOf(EmptyResponseException.class);
        }

        @Test
        void nullChatResponse_throwsEmptyResponseException() {
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenReturn(null);

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOf(EmptyResponseException.class);
        }

        @Test
        @DisplayName("a slow service times out with the timeout flag set")
        void slowService_timesOut() {
            SpringAiGenerationClient impatient =
                    new SpringAiGenerationClient(chatClient, executor, Duration.ofMillis(100));
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return responseOf("too late");
            });

            assertThatThrownBy(() -> impatient.generate(REQUEST))
                    .isInstanceOfSatisfying(GenerationException.class, e -> {
                        assertThat(e.isTimeout()).isTrue();
                        assertThat(e.isTransient()).isTrue();
                    });
        }

        @Test
        void transientAiException_isTransient() {
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenThrow(new TransientAiException("HTTP 503 - model overloaded"));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOfSatisfying(GenerationException.class, e -> {
                        assertThat(e.isTransient()).isTrue();
                        assertThat(e.isTimeout()).isFalse();
                        assertThat(e.getMessage()).contains("model overloaded");
                    });
        }

        @Test
        void rateLimitMessage_isTransient() {
            stubCallChain();
            when(callResponseSpec.chatResponse())
                    .thenThrow(new NonTransientAiException("429 - RESOURCE_EXHAUSTED: quota exceeded"));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOfSatisfying(GenerationException.class, e -> assertThat(e.isTransient()).isTrue());
        }

        @Test
        void ioFailure_isTransient() {
            stubCallChain();
            when(callResponseSpec.chatResponse()).thenThrow(new ResourceAccessException("Connection refused"));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOfSatisfying(GenerationException.class, e -> assertThat(e.isTransient()).isTrue());
        }

        @Test
        void authFailure_isNotTransient() {
            stubCallChain();
            when(callResponseSpec.chatResponse())
                    .thenThrow(new NonTransientAiException("401 - API key not valid"));

            assertThatThrownBy(() -> client.generate(REQUEST))
                    .isInstanceOfSatisfying(GenerationException.class, e -> {
                        assertThat(e.isTransient()).isFalse();
                        assertThat(e.getMessage()).contains("API key not valid");
                        assertThat(e.getCause()).isInstanceOf(NonTransientAiException.class);
                    });
        }
    }
}
