package com.moonscribe.rag.llm.anthropic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.moonscribe.rag.exception.UpstreamProviderException;
import com.moonscribe.rag.http.Http;
import com.moonscribe.rag.json.Json;
import com.moonscribe.rag.llm.ChatClient;
import com.moonscribe.rag.llm.ChatCompletion;
import com.moonscribe.rag.llm.CompletionSettings;
import com.moonscribe.rag.llm.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Anthropic messages client.
 * Endpoint: POST /v1/messages
 * Response: { "content": [ { "type": "text", "text": "..." } ], "usage": { "input_tokens": N, "output_tokens": M } }
 *
 * The messages API has no JSON response format; {@link CompletionSettings#jsonOutput()} is
 * ignored and the prompt is expected to ask for JSON itself.
 */
public final class AnthropicChatClient implements ChatClient {
    private static final Logger log = LoggerFactory.getLogger(AnthropicChatClient.class);

    static final String API_VERSION = "2023-06-01";

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;

    public AnthropicChatClient(HttpClient http, String baseUrl, Duration timeout) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }

    @Override
    public ProviderKind provider() {
        return ProviderKind.ANTHROPIC;
    }

    @Override
    public ChatCompletion complete(String prompt, String model, CompletionSettings settings, String apiKey) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("model", model);
            body.put("max_tokens", settings.maxTokens());
            body.put("temperature", settings.temperature());
            body.putArray("messages")
                    .addObject()
                    .put("role", "user")
                    .put("content", prompt);

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/messages"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (!Http.isSuccess(resp)) {
                throw new UpstreamProviderException("completion",
                        "Anthropic HTTP " + resp.statusCode() + " for model " + model + ": " + errorMessage(resp.body()),
                        resp.statusCode(), null);
            }

            ChatCompletion completion = parseResponse(resp.body(), model);
            log.debug("[CHAT TIMING] anthropic total={}ms promptLen={} tokens={}",
                    System.currentTimeMillis() - startTime, prompt.length(), completion.tokensUsed());
            return completion;
        } catch (UpstreamProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("completion", "Anthropic call interrupted for model " + model, e);
        } catch (IOException e) {
            throw new UpstreamProviderException("completion", "Anthropic call failed for model " + model + ": " + e.getMessage(), e);
        }
    }

    static ChatCompletion parseResponse(String json, String model) throws IOException {
        JsonNode root = Json.MAPPER.readTree(json);
        JsonNode text = root.at("/content/0/text");
        if (!text.isTextual()) {
            throw new UpstreamProviderException("completion",
                    "Bad Anthropic response for model " + model + ": missing content[0].text");
        }
        int tokens = root.at("/usage/input_tokens").asInt(0) + root.at("/usage/output_tokens").asInt(0);
        return new ChatCompletion(text.asText(), tokens, ProviderKind.ANTHROPIC, model);
    }

    // Error envelope: { "type": "error", "error": { "type": "...", "message": "..." } }
    static String errorMessage(String body) {
        try {
            JsonNode message = Json.MAPPER.readTree(body).at("/error/message");
            return message.isTextual() ? message.asText() : Http.excerpt(body, 200);
        } catch (IOException e) {
            return Http.excerpt(body, 200);
        }
    }
}
