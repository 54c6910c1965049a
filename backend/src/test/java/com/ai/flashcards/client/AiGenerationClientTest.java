package com.ai.flashcards.client;

import com.ai.flashcards.exception.GenerationErrorType;
import com.ai.flashcards.exception.GenerationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AiGenerationClientTest {

    @Mock
    private LlmClient llmClient;

    private final List<Long> delays = new ArrayList<>();

    private AiGenerationClient client;

    @BeforeEach
    void setUp() {
        client = new AiGenerationClient(llmClient, RetryPolicy.defaultPolicy(), delays::add);
    }

    @Test
    void shouldReturnSuccessAfterTwoRetryableFailures() throws Exception {
        // GIVEN
        when(llmClient.call(anyString(), anyString(), anyString()))
                .thenThrow(new LlmApiException("openai", 429, "{\"error\":\"rate limited\"}"))
                .thenThrow(new LlmApiException("openai", 503, "unavailable"))
                .thenReturn("{\"flashcards\":[]}");

        // WHEN
        String result = client.generate("prompt", "gpt-4o", "key");

        // THEN
        assertThat(result).isEqualTo("{\"flashcards\":[]}");
        assertThat(delays).containsExactly(500L, 1000L);
        verify(llmClient, times(3)).call("prompt", "gpt-4o", "key");
    }

    @Test
    void shouldFailImmediatelyOnQuotaExceeded() throws Exception {
        when(llmClient.call(anyString(), anyString(), anyString()))
                .thenThrow(new LlmApiException("openai", 429, "{\"error\":{\"code\":\"insufficient_quota\"}}"));

        assertThatThrownBy(() -> client.generate("prompt", "gpt-4o", "key"))
                .isInstanceOf(GenerationException.class)
                .satisfies(e -> assertThat(((GenerationException) e).getType())
                        .isEqualTo(GenerationErrorType.QUOTA_EXCEEDED));

        assertThat(delays).isEmpty();
        verify(llmClient, times(1)).call(anyString(), anyString(), anyString());
    }

    @Test
    void shouldFailImmediatelyOnClientError() throws Exception {
        when(llmClient.call(anyString(), anyString(), anyString()))
                .thenThrow(new LlmApiException("openai", 401, "invalid api key"));

        assertThatThrownBy(() -> client.generate("prompt", "gpt-4o", "key"))
                .isInstanceOf(GenerationException.class)
                .satisfies(e -> assertThat(((GenerationException) e).getType())
                        .isEqualTo(GenerationErrorType.CLIENT_ERROR));

        assertThat(delays).isEmpty();
    }

    @Test
    void shouldPropagateClassifiedErrorWhenRetriesRunOut() throws Exception {
        when(llmClient.call(anyString(), anyString(), anyString()))
                .thenThrow(new ConnectException("Connection refused"));

        assertThatThrownBy(() -> client.generate("prompt", "gpt-4o", "key"))
                .isInstanceOf(GenerationException.class)
                .satisfies(e -> assertThat(((GenerationException) e).getType())
                        .isEqualTo(GenerationErrorType.NETWORK_ERROR));

        assertThat(delays).containsExactly(500L, 1000L);
        verify(llmClient, times(3)).call(anyString(), anyString(), anyString());
    }

    @Test
    void shouldTreatBlankResponseAsInvalidWithoutRetrying() throws Exception {
        when(llmClient.call(anyString(), anyString(), anyString())).thenReturn("   ");

        assertThatThrownBy(() -> client.generate("prompt", "gpt-4o", "key"))
                .isInstanceOf(GenerationException.class)
                .satisfies(e -> assertThat(((GenerationException) e).getType())
                        .isEqualTo(GenerationErrorType.INVALID_RESPONSE));

        assertThat(delays).isEmpty();
    }

    @Test
    void shouldTreatNonJsonSuccessBodyAsInvalidWithoutRetrying() throws Exception {
        // GIVEN a 2xx answer whose body is an HTML error page
        when(llmClient.call(anyString(), anyString(), anyString()))
                .thenAnswer(inv -> new ObjectMapper().readTree("<html>Bad gateway</html>").toString());

        // WHEN / THEN
        assertThatThrownBy(() -> client.generate("prompt", "gpt-4o", "key"))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("malformed payload")
                .satisfies(e -> assertThat(((GenerationException) e).getType())
                        .isEqualTo(GenerationErrorType.INVALID_RESPONSE));

        assertThat(delays).isEmpty();
        verify(llmClient, times(1)).call(anyString(), anyString(), anyString());
    }

    @Test
    void shouldCapDelaysAtMaximum() throws IOException, InterruptedException {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(4).baseDelayMs(500).maxDelayMs(3000).build();
        client = new AiGenerationClient(llmClient, policy, delays::add);
        when(llmClient.call(anyString(), anyString(), anyString()))
                .thenThrow(new LlmApiException("claude", 500, "boom"));

        assertThatThrownBy(() -> client.generate("prompt", "claude-3", "key"))
                .isInstanceOf(GenerationException.class);

        assertThat(delays).containsExactly(500L, 1000L, 2000L, 3000L);
    }
}
