package com.moonscribe.rag.vector.qdrant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.moonscribe.rag.exception.UpstreamProviderException;
import com.moonscribe.rag.http.Http;
import com.moonscribe.rag.json.Json;
import com.moonscribe.rag.vector.EmbeddingVector;
import com.moonscribe.rag.vector.MetadataFilter;
import com.moonscribe.rag.vector.SearchHit;
import com.moonscribe.rag.vector.VectorIndexClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Qdrant REST implementation of the vector index.
 */
public final class QdrantVectorIndex implements VectorIndexClient {
    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    private final HttpClient http;
    private final String baseUrl;
    private final String collection;
    private final int vectorSize;
    private final String distance;
    private final Duration timeout;

    private volatile boolean ensured = false;

    public QdrantVectorIndex(HttpClient http, String baseUrl, String collection, int vectorSize, String distance, Duration timeout) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.collection = collection;
        this.vectorSize = vectorSize;
        this.distance = (distance == null || distance.isBlank()) ? "Cosine" : distance;
        this.timeout = timeout;
    }

    public String collection() {
        return collection;
    }

    public int vectorSize() {
        return vectorSize;
    }

    public void ensureCollectionExists() {
        if (ensured) return;
        synchronized (this) {
            if (ensured) return;

            try {
                HttpRequest getReq = HttpRequest.newBuilder()
                        .uri(collectionUri(""))
                        .timeout(timeout)
                        .GET()
                        .build();

                HttpResponse<String> getResp = http.send(getReq, HttpResponse.BodyHandlers.ofString());
                if (getResp.statusCode() == 200) {
                    ensured = true;
                    return;
                }
                if (getResp.statusCode() != 404) {
                    throw new UpstreamProviderException("vector-collection",
                            "Qdrant GET collection " + collection + " HTTP " + getResp.statusCode() + ": "
                                    + Http.excerpt(getResp.body(), 200), getResp.statusCode(), null);
                }

                ObjectNode body = Json.MAPPER.createObjectNode();
                body.putObject("vectors")
                        .put("size", vectorSize)
                        .put("distance", distance);

                HttpResponse<String> putResp = send(HttpRequest.newBuilder()
                        .uri(collectionUri(""))
                        .PUT(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body))));
                if (!Http.isSuccess(putResp)) {
                    throw new UpstreamProviderException("vector-collection",
                            "Qdrant CREATE collection " + collection + " HTTP " + putResp.statusCode() + ": "
                                    + Http.excerpt(putResp.body(), 200), putResp.statusCode(), null);
                }

                log.info("Created Qdrant collection {} (size={}, distance={})", collection, vectorSize, distance);
                ensured = true;
            } catch (UpstreamProviderException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamProviderException("vector-collection", "Interrupted while ensuring collection " + collection, e);
            } catch (IOException e) {
                throw new UpstreamProviderException("vector-collection", "Failed to ensure Qdrant collection " + collection + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public void upsert(List<EmbeddingVector> vectors) {
        if (vectors.isEmpty()) return;
        for (EmbeddingVector v : vectors) {
            if (v.dimension() != vectorSize) {
                throw new IllegalArgumentException("Vector dimension mismatch for id=" + v.id()
                        + " expected=" + vectorSize + " got=" + v.dimension());
            }
        }
        ensureCollectionExists();

        try {
            ArrayNode arr = Json.MAPPER.createArrayNode();
            for (EmbeddingVector v : vectors) {
                ObjectNode obj = arr.addObject();
                obj.put("id", v.id());
                obj.set("vector", toArray(v.values()));
                obj.set("payload", Json.MAPPER.valueToTree(v.metadata()));
            }
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("points", arr);

            HttpResponse<String> resp = send(HttpRequest.newBuilder()
                    .uri(collectionUri("/points?wait=true"))
                    .PUT(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body))));
            if (!Http.isSuccess(resp)) {
                throw new UpstreamProviderException("vector-upsert",
                        "Qdrant upsert into " + collection + " HTTP " + resp.statusCode() + ": " + Http.excerpt(resp.body(), 200),
                        resp.statusCode(), null);
            }
            log.debug("[QDRANT] upserted {} points into {}", vectors.size(), collection);
        } catch (UpstreamProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("vector-upsert", "Qdrant upsert into " + collection + " interrupted", e);
        } catch (IOException e) {
            throw new UpstreamProviderException("vector-upsert", "Qdrant upsert into " + collection + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<SearchHit> query(float[] vector, int topK, MetadataFilter filter, boolean includeMetadata) {
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive");
        }
        long startTime = System.currentTimeMillis();
        ensureCollectionExists();

        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("vector", toArray(vector));
            body.put("limit", topK);
            body.put("with_payload", includeMetadata);
            if (filter != null && !filter.isEmpty()) {
                body.set("filter", toQdrantFilter(filter));
            }

            HttpResponse<String> resp = send(HttpRequest.newBuilder()
                    .uri(collectionUri("/points/search"))
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body))));
            if (!Http.isSuccess(resp)) {
                throw new UpstreamProviderException("vector-query",
                        "Qdrant search in " + collection + " HTTP " + resp.statusCode() + ": " + Http.excerpt(resp.body(), 200),
                        resp.statusCode(), null);
            }

            List<SearchHit> hits = parseHits(resp.body());
            log.debug("[QDRANT TIMING] search total={}ms topK={} filter={} hits={}",
                    System.currentTimeMillis() - startTime, topK, filter, hits.size());
            return hits;
        } catch (UpstreamProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("vector-query", "Qdrant search in " + collection + " interrupted", e);
        } catch (IOException e) {
            throw new UpstreamProviderException("vector-query", "Qdrant search in " + collection + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void deleteBySource(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        ensureCollectionExists();

        try {
            ObjectNode body = Json.MAPPER.createObjectNode();
            body.set("filter", toQdrantFilter(MetadataFilter.eq(EmbeddingVector.SOURCE, source)));

            HttpResponse<String> resp = send(HttpRequest.newBuilder()
                    .uri(collectionUri("/points/delete?wait=true"))
                    .POST(HttpRequest.BodyPublishers.ofString(Json.MAPPER.writeValueAsString(body))));
            if (!Http.isSuccess(resp)) {
                throw new UpstreamProviderException("vector-delete",
                        "Qdrant delete of source " + source + " HTTP " + resp.statusCode() + ": " + Http.excerpt(resp.body(), 200),
                        resp.statusCode(), null);
            }
            log.info("[QDRANT] deleted vectors of source {} from {}", source, collection);
        } catch (UpstreamProviderException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamProviderException("vector-delete", "Qdrant delete of source " + source + " interrupted", e);
        } catch (IOException e) {
            throw new UpstreamProviderException("vector-delete", "Qdrant delete of source " + source + " failed: " + e.getMessage(), e);
        }
    }

    static ObjectNode toQdrantFilter(MetadataFilter filter) {
        ArrayNode must = Json.MAPPER.createArrayNode();
        for (MetadataFilter.Condition c : filter.conditions()) {
            ObjectNode cond = must.addObject();
            cond.put("key", c.field());
            ObjectNode match = cond.putObject("match");
            if (c.op() == MetadataFilter.Op.EQ) {
                match.set("value", Json.MAPPER.valueToTree(c.values().get(0)));
            } else {
                match.set("any", Json.MAPPER.valueToTree(c.values()));
            }
        }
        ObjectNode out = Json.MAPPER.createObjectNode();
        out.set("must", must);
        return out;
    }

    static List<SearchHit> parseHits(String json) throws IOException {
        JsonNode result = Json.MAPPER.readTree(json).get("result");
        if (result == null || !result.isArray()) return List.of();

        List<SearchHit> out = new ArrayList<>();
        for (JsonNode hit : result) {
            JsonNode payload = hit.path("payload");
            JsonNode startTime = payload.get(EmbeddingVector.START_TIME);
            out.add(new SearchHit(
                    payload.path(EmbeddingVector.TEXT).asText(""),
                    payload.path(EmbeddingVector.SOURCE).asText("Unknown"),
                    hit.path("score").asDouble(0.0),
                    payload.path(EmbeddingVector.SOURCE_TYPE).asText("document"),
                    textOrNull(payload.get(EmbeddingVector.URL)),
                    startTime != null && startTime.isNumber() ? startTime.asDouble() : null,
                    textOrNull(payload.get(EmbeddingVector.MEDIA_ID))
            ));
        }
        return out;
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws IOException, InterruptedException {
        HttpRequest req = builder
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private URI collectionUri(String suffix) {
        return URI.create(baseUrl + "/collections/" + collection + suffix);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static ArrayNode toArray(float[] v) {
        ArrayNode a = Json.MAPPER.createArrayNode();
        for (float f : v) a.add(f);
        return a;
    }
}
