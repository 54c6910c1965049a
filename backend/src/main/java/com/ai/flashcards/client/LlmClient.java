package com.ai.flashcards.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * LlmClient performs one raw call to the configured AI provider.
 * Supports OpenAI, Anthropic Claude and a local Ollama server; the provider
 * is selected via the 'llm.provider' configuration property, while model and
 * credential are chosen per call.
 *
 * <p>
 * Non-2xx answers surface as {@link LlmApiException} with the provider's status
 * code; transport failures surface as plain {@link IOException}. No retrying
 * happens here.
 * </p>
 */
@Slf4j
@Component
public class LlmClient {

    private static final String SYSTEM_PROMPT = "You are an expert instructor creating educational flashcards. "
            + "Generate high-quality question-answer pairs. Always respond with valid JSON in the exact format requested.";

    @Value("${llm.provider:openai}")
    private String provider;

    @Value("${openai.api.url:https://api.openai.com/v1/chat/completions}")
    private String openAiApiUrl;

    @Value("${claude.api.url:https://api.anthropic.com/v1/messages}")
    private String claudeApiUrl;

    @Value("${ollama.api.url:http://localhost:11434/api/generate}")
    private String ollamaApiUrl;

    @Value("${llm.max-tokens:4000}")
    private int maxTokens;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .build();

    /**
     * Send a prompt to the configured provider and return the raw text of its answer.
     *
     * @param prompt     the constructed prompt
     * @param model      provider model name
     * @param credential API key for the provider (ignored by Ollama)
     * @return the model's text output, possibly wrapped in formatting noise
     * @throws LlmApiException if the provider answered with a non-2xx status
     * @throws IOException     if the provider could not be reached
     */
    public String call(String prompt, String model, String credential) throws IOException, InterruptedException {
        log.debug("Calling LLM provider={} model={}", provider, model);
        return switch (provider.toLowerCase()) {
            case "claude" -> callClaude(prompt, model, credential);
            case "ollama" -> callOllama(prompt, model);
            default -> callOpenAi(prompt, model, credential);
        };
    }

    // ─────────────────────────────────────────────────────────────────────────────
    // OpenAI
    // ─────────────────────────────────────────────────────────────────────────────
    private String callOpenAi(String prompt, String model, String credential)
            throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", 0.7);
        body.set("response_format", objectMapper.createObjectNode().put("type", "json_object"));

        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", prompt);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(openAiApiUrl))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + credential)
                .timeout(Duration.ofSeconds(120))
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        return send("OpenAI", request).at("/choices/0/message/content").asText();
    }

    // ─────────────────────────────────────────────────────────────────────────────
    // Anthropic Claude
    // ─────────────────────────────────────────────────────────────────────────────
    private String callClaude(String prompt, String model, String credential)
            throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", 0.7);
        body.put("system", SYSTEM_PROMPT);
        body.putArray("messages").addObject().put("role", "user").put("content", prompt);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(claudeApiUrl))
                .header("Content-Type", "application/json")
                .header("x-api-key", credential)
                .header("anthropic-version", "2023-06-01")
                .timeout(Duration.ofSeconds(120))
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        return send("Claude", request).at("/content/0/text").asText();
    }

    // ─────────────────────────────────────────────────────────────────────────────
    // Ollama (local)
    // ─────────────────────────────────────────────────────────────────────────────
    private String callOllama(String prompt, String model) throws IOException, InterruptedException {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model);
        body.put("prompt", SYSTEM_PROMPT + "\n\n" + prompt);
        body.put("stream", false);
        body.put("format", "json");

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(ollamaApiUrl))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(300)) // local models can be slow
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                .build();

        return send("Ollama", request).at("/response").asText();
    }

    private JsonNode send(String providerName, HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        log.debug("{} response status: {}", providerName, response.statusCode());

        if (response.statusCode() / 100 != 2) {
            throw new LlmApiException(providerName, response.statusCode(), response.body());
        }
        return objectMapper.readTree(response.body());
    }
}
