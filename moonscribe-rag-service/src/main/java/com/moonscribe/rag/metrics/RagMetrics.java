package com.moonscribe.rag.metrics;

import com.moonscribe.rag.credit.KeySource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the ingestion and query pipeline.
 * Exposed to Prometheus through the actuator endpoint.
 */
@Component
public class RagMetrics {

    // Timers
    private final Timer embeddingTimer;
    private final Timer vectorSearchTimer;
    private final Timer completionTimer;
    private final Timer ingestTimer;

    // Counters
    private final Map<KeySource, Counter> requestsByKeySource = new EnumMap<>(KeySource.class);
    private final Counter creditsDeductedCounter;
    private final Counter deductionFailureCounter;
    private final Counter parseFallbackCounter;
    private final Counter parseFailureCounter;
    private final Counter providerFallbackCounter;
    private final Counter chunkCreatedCounter;

    public RagMetrics(MeterRegistry registry) {
        this.embeddingTimer = Timer.builder("rag.embedding.duration")
                .description("Time to embed a batch of texts")
                .tags("component", "embedding")
                .register(registry);

        this.vectorSearchTimer = Timer.builder("rag.vector.search.duration")
                .description("Time for vector similarity search")
                .tags("component", "vector-index")
                .register(registry);

        this.completionTimer = Timer.builder("rag.completion.duration")
                .description("Time for the completion provider to answer")
                .tags("component", "llm")
                .register(registry);

        this.ingestTimer = Timer.builder("rag.ingest.duration")
                .description("Time to ingest a document")
                .tags("operation", "ingest")
                .register(registry);

        for (KeySource source : KeySource.values()) {
            requestsByKeySource.put(source, Counter.builder("rag.requests.total")
                    .description("Requests served, by key source")
                    .tags("keySource", source.name())
                    .register(registry));
        }

        this.creditsDeductedCounter = Counter.builder("rag.credits.deducted")
                .description("Credits deducted after successful requests")
                .register(registry);

        this.deductionFailureCounter = Counter.builder("rag.credits.deduction.failures")
                .description("Deductions that failed after the request succeeded")
                .register(registry);

        this.parseFallbackCounter = Counter.builder("rag.parse.outcome")
                .description("Structured outputs recovered by array extraction")
                .tags("outcome", "fallback")
                .register(registry);

        this.parseFailureCounter = Counter.builder("rag.parse.outcome")
                .description("Structured outputs that could not be parsed")
                .tags("outcome", "failed")
                .register(registry);

        this.providerFallbackCounter = Counter.builder("rag.completion.provider.fallback")
                .description("Completions served by the credential's provider instead of the requested one")
                .register(registry);

        this.chunkCreatedCounter = Counter.builder("rag.chunks.created")
                .description("Number of chunks created")
                .tags("operation", "ingest")
                .register(registry);
    }

    public void recordEmbeddingTime(long durationMs) {
        embeddingTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordVectorSearchTime(long durationMs) {
        vectorSearchTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordCompletionTime(long durationMs) {
        completionTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordIngest(long durationMs, int chunkCount) {
        ingestTimer.record(durationMs, TimeUnit.MILLISECONDS);
        chunkCreatedCounter.increment(chunkCount);
    }

    public void recordRequest(KeySource keySource) {
        requestsByKeySource.get(keySource).increment();
    }

    public void recordCreditsDeducted(int amount) {
        creditsDeductedCounter.increment(amount);
    }

    public void recordDeductionFailure() {
        deductionFailureCounter.increment();
    }

    public void recordParseFallback() {
        parseFallbackCounter.increment();
    }

    public void recordParseFailure() {
        parseFailureCounter.increment();
    }

    public void recordProviderFallback() {
        providerFallbackCounter.increment();
    }
}
