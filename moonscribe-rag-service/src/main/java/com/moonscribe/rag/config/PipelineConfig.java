package com.moonscribe.rag.config;

import com.moonscribe.rag.chunk.DocumentChunker;
import com.moonscribe.rag.context.ContextSelector;
import com.moonscribe.rag.ingest.EmbeddingBatcher;
import com.moonscribe.rag.llm.EmbeddingsClient;
import com.moonscribe.rag.metrics.RagMetrics;
import com.moonscribe.rag.parse.StructuredOutputParser;
import com.moonscribe.rag.query.QueryExpander;
import com.moonscribe.rag.team.ApiKeyCipher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public DocumentChunker documentChunker(@Value("${moonscribe.rag.chunking.targetTokens:1500}") int targetTokens) {
        return new DocumentChunker(targetTokens);
    }

    /**
     * Bounded pool for embedding fan-out. When the queue is full the submitting request thread
     * runs the call itself.
     */
    @Bean(name = "embeddingExecutor", destroyMethod = "shutdown")
    public ExecutorService embeddingExecutor(
            @Value("${moonscribe.rag.embedding.maxConcurrent:8}") int maxConcurrent,
            @Value("${moonscribe.rag.embedding.queueCapacity:256}") int queueCapacity
    ) {
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "embed-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        int threads = Math.max(1, maxConcurrent);
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                tf,
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean
    public EmbeddingBatcher embeddingBatcher(EmbeddingsClient embeddingsClient,
                                             @Qualifier("embeddingExecutor") ExecutorService embeddingExecutor,
                                             RagMetrics metrics) {
        return new EmbeddingBatcher(embeddingsClient, embeddingExecutor, metrics);
    }

    @Bean
    public ContextSelector contextSelector(
            @Value("${moonscribe.rag.retrieval.maxPerSource:3}") int maxPerSource,
            @Value("${moonscribe.rag.retrieval.maxTotal:20}") int maxTotal,
            @Value("${moonscribe.rag.retrieval.minTextLength:50}") int minTextLength
    ) {
        return new ContextSelector(maxPerSource, maxTotal, minTextLength);
    }

    @Bean
    public QueryExpander queryExpander() {
        return new QueryExpander();
    }

    @Bean
    public StructuredOutputParser flashcardOutputParser(RagMetrics metrics) {
        return new StructuredOutputParser(List.of("flashcards", "cards"), metrics);
    }

    @Bean
    public ApiKeyCipher apiKeyCipher(@Value("${moonscribe.rag.team.encryptionSecret:}") String secret) {
        return new ApiKeyCipher(secret);
    }
}
