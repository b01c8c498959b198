package com.moonscribe.rag.llm.openai;

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
 * OpenAI chat completions client.
 * Endpoint: POST /v1/chat/completions
 * Response: { "choices": [ { "message": { "content": "..." } } ], "usage": { "total_tokens": N } }
 */
public final class OpenAIChatClient implements ChatClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAIChatClient.class);

    private final HttpClient http;
    private final String baseUrl;
    private final Duration timeout;

    public OpenAIChatClient(HttpClient http, String baseUrl, Duration timeout) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
    }

    @Override
    public ProviderKind provider() {
        return ProviderKind.OPENAI;
    }

    @Override
    public ChatCompletion complete(String prompt, String model, CompletionSettings settings, String apiKey) {
        long startTime = System.currentTimeMillis();
        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.put("model", model);
            body.put("temperature", settings.temperature());
            body.put("max_tokens", settings.maxTokens());
            if (settings.jsonOutput()) {
                body.putObject("response_format").put("type", "json_object");
            }
            body.putArray("messages")
                    .addObject()
                    .put("role", "user")
                    .put("content", prompt);

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/chat/completions"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (!Http.isSuccess(resp)) {
                throw new UpstreamProviderException("completion",
                        "OpenAI chat HTTP " + resp.statusCode() + " for model " + model + ": " + errorMessage(resp.body()),
                        resp.statusCode(), null);
            }

            ChatCompletion completion = parseResponse(resp.body(), model);
            log.debug("[CHAT TIMING] openai total={}ms promptLen={} tokens={}",
                    System.currentTimeMillis() - startTime, prompt.length(), completion.tokensUsed());
            return completion;
        } catch (UpstreamProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("completion", "OpenAI chat interrupted for model " + model, e);
        } catch (IOException e) {
            throw new UpstreamProviderException("completion", "OpenAI chat failed for model " + model + ": " + e.getMessage(), e);
        }
    }

    static ChatCompletion parseResponse(String json, String model) throws IOException {
        JsonNode root = Json.MAPPER.readTree(json);
        JsonNode content = root.at("/choices/0/message/content");
        if (!content.isTextual()) {
            throw new UpstreamProviderException("completion",
                    "Bad OpenAI chat response for model " + model + ": missing choices[0].message.content");
        }
        int tokens = root.at("/usage/total_tokens").asInt(0);
        return new ChatCompletion(content.asText(), tokens, ProviderKind.OPENAI, model);
    }

    static String errorMessage(String body) {
        try {
            JsonNode message = Json.MAPPER.readTree(body).at("/error/message");
            return message.isTextual() ? message.asText() : Http.excerpt(body, 200);
        } catch (IOException e) {
            return Http.excerpt(body, 200);
        }
    }
}
