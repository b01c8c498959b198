package com.moonscribe.rag.ingest;

import com.moonscribe.rag.exception.UpstreamProviderException;
import com.moonscribe.rag.llm.Embedding;
import com.moonscribe.rag.llm.EmbeddingsClient;
import com.moonscribe.rag.metrics.RagMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Embeds texts with one provider call per text, fanned out on a bounded executor and joined.
 * The batch succeeds only if every call succeeds.
 */
public class EmbeddingBatcher {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingBatcher.class);

    private final EmbeddingsClient client;
    private final ExecutorService executor;
    private final RagMetrics metrics;

    public EmbeddingBatcher(EmbeddingsClient client, ExecutorService executor, RagMetrics metrics) {
        this.client = client;
        this.executor = executor;
        this.metrics = metrics;
    }

    public String model() {
        return client.model();
    }

    /**
     * @throws UpstreamProviderException (stage {@code embedding}) if any text fails to embed
     */
    public EmbeddingBatch embed(List<String> texts, String apiKey) {
        if (texts.isEmpty()) {
            return new EmbeddingBatch(List.of(), 0);
        }
        long start = System.currentTimeMillis();

        List<CompletableFuture<Embedding>> futures = new ArrayList<>(texts.size());
        try {
            for (String text : texts) {
                futures.add(CompletableFuture.supplyAsync(() -> client.embed(text, apiKey), executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException | RejectedExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw asUpstream(e);
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        int totalTokens = 0;
        int dimension = -1;
        for (CompletableFuture<Embedding> f : futures) {
            Embedding embedding = f.join();
            if (dimension < 0) {
                dimension = embedding.dimension();
            } else if (embedding.dimension() != dimension) {
                throw new UpstreamProviderException("embedding", "Embedding model " + client.model()
                        + " returned mixed dimensions " + dimension + " and " + embedding.dimension());
            }
            vectors.add(embedding.values());
            totalTokens += embedding.tokensUsed();
        }

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordEmbeddingTime(elapsed);
        log.info("[TIMING] embedded {} texts with {} in {}ms (dim={}, tokens={})",
                texts.size(), client.model(), elapsed, dimension, totalTokens);
        return new EmbeddingBatch(vectors, totalTokens);
    }

    public Embedding embedOne(String text, String apiKey) {
        long start = System.currentTimeMillis();
        Embedding embedding = client.embed(text, apiKey);
        metrics.recordEmbeddingTime(System.currentTimeMillis() - start);
        return embedding;
    }

    private UpstreamProviderException asUpstream(RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof UpstreamProviderException) {
            return (UpstreamProviderException) cause;
        }
        return new UpstreamProviderException("embedding",
                "Embedding batch with model " + client.model() + " failed: " + cause.getMessage(), cause);
    }
}
