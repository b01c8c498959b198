package com.moonscribe.rag.llm.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.moonscribe.rag.exception.UpstreamProviderException;
import com.moonscribe.rag.http.Http;
import com.moonscribe.rag.json.Json;
import com.moonscribe.rag.llm.Embedding;
import com.moonscribe.rag.llm.EmbeddingsClient;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * OpenAI embeddings client.
 * Endpoint: POST /v1/embeddings
 *
 * Request: { "model": "...", "input": "text" }
 * Response: { "data": [ { "embedding": [...] } ], "usage": { "total_tokens": N } }
 */
public final class OpenAIEmbeddingsClient implements EmbeddingsClient {
    private final HttpClient http;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;

    public OpenAIEmbeddingsClient(HttpClient http, String baseUrl, String model, Duration timeout) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.model = model;
        this.timeout = timeout;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public Embedding embed(String text, String apiKey) {
        try {
            ObjectNode body = Json.MAPPER.createObjectNode()
                    .put("model", model)
                    .put("input", text);

            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/v1/embeddings"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body)))
                    .build();

            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (!Http.isSuccess(resp)) {
                throw new UpstreamProviderException("embedding",
                        "OpenAI embed HTTP " + resp.statusCode() + " for model " + model + ": "
                                + OpenAIChatClient.errorMessage(resp.body()),
                        resp.statusCode(), null);
            }
            return parseResponse(resp.body(), model);
        } catch (UpstreamProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("embedding", "OpenAI embedding interrupted for model " + model, e);
        } catch (IOException e) {
            throw new UpstreamProviderException("embedding", "OpenAI embedding failed for model " + model + ": " + e.getMessage(), e);
        }
    }

    static Embedding parseResponse(String json, String model) throws IOException {
        JsonNode root = Json.MAPPER.readTree(json);

        JsonNode data = root.get("data");
        if (data == null || !data.isArray() || data.isEmpty()) {
            throw new UpstreamProviderException("embedding", "Bad OpenAI embed response for model " + model + ": missing data array");
        }

        JsonNode vec = data.get(0).get("embedding");
        if (vec == null || !vec.isArray() || vec.size() <= 1) {
            throw new UpstreamProviderException("embedding", "Bad OpenAI embed response for model " + model + ": missing embedding array");
        }

        float[] values = new float[vec.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (float) vec.get(i).asDouble();
        }
        return new Embedding(values, root.at("/usage/total_tokens").asInt(0));
    }
}
