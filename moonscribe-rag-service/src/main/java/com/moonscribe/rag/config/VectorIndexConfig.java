package com.moonscribe.rag.config;

import com.moonscribe.rag.vector.qdrant.QdrantVectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class VectorIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexConfig.class);

    private final ApplicationContext applicationContext;
    private final boolean initOnStartup;

    public VectorIndexConfig(ApplicationContext applicationContext,
                             @Value("${moonscribe.rag.qdrant.initOnStartup:true}") boolean initOnStartup) {
        this.applicationContext = applicationContext;
        this.initOnStartup = initOnStartup;
    }

    @Bean
    public QdrantVectorIndex qdrantVectorIndex(
            HttpClient ragHttpClient,
            @Value("${moonscribe.rag.qdrant.baseUrl}") String baseUrl,
            @Value("${moonscribe.rag.qdrant.collection}") String collection,
            @Value("${moonscribe.rag.embedding.dimension:3072}") int vectorSize,
            @Value("${moonscribe.rag.qdrant.distance:Cosine}") String distance,
            @Value("${moonscribe.rag.qdrant.timeoutSeconds:30}") int timeoutSeconds
    ) {
        if (collection == null || collection.isBlank()) {
            throw new IllegalStateException("moonscribe.rag.qdrant.collection must be set");
        }
        return new QdrantVectorIndex(ragHttpClient, baseUrl, collection, vectorSize, distance, Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * Creates the collection at startup so the first request does not pay for it.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeCollection() {
        if (!initOnStartup) return;
        try {
            QdrantVectorIndex index = applicationContext.getBean(QdrantVectorIndex.class);
            index.ensureCollectionExists();
            log.info("Qdrant collection {} ready", index.collection());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Qdrant collection (Qdrant may not be available): {}", e.getMessage());
        }
    }
}
