package com.moonscribe.rag.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.moonscribe.rag.context.ContextSelector;
import com.moonscribe.rag.context.ContextWindow;
import com.moonscribe.rag.credit.CreditAction;
import com.moonscribe.rag.credit.CreditSettlement;
import com.moonscribe.rag.credit.KeyResolution;
import com.moonscribe.rag.credit.KeyResolver;
import com.moonscribe.rag.dto.Flashcard;
import com.moonscribe.rag.dto.FlashcardRequest;
import com.moonscribe.rag.dto.FlashcardResponse;
import com.moonscribe.rag.exception.StructuredOutputException;
import com.moonscribe.rag.ingest.EmbeddingBatcher;
import com.moonscribe.rag.llm.ChatCompletion;
import com.moonscribe.rag.llm.CompletionOrchestrator;
import com.moonscribe.rag.llm.CompletionSettings;
import com.moonscribe.rag.llm.Embedding;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.metrics.RagMetrics;
import com.moonscribe.rag.parse.ParseOutcome;
import com.moonscribe.rag.parse.StructuredOutputParser;
import com.moonscribe.rag.query.QueryExpander;
import com.moonscribe.rag.usage.UsageOperation;
import com.moonscribe.rag.usage.UsageRecorder;
import com.moonscribe.rag.vector.EmbeddingVector;
import com.moonscribe.rag.vector.MetadataFilter;
import com.moonscribe.rag.vector.SearchHit;
import com.moonscribe.rag.vector.VectorIndexClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generates flashcards from selected sources, one completion per source.
 */
@Service
public class FlashcardService {
    private static final Logger log = LoggerFactory.getLogger(FlashcardService.class);

    static final String RETRIEVAL_QUERY = "key concepts important information main points definitions facts";
    private static final CompletionSettings SETTINGS = CompletionSettings.json(0.7, 2000);
    private static final int MIN_CARDS_PER_SOURCE = 3;

    private final KeyResolver keyResolver;
    private final EmbeddingBatcher batcher;
    private final VectorIndexClient vectorIndex;
    private final ContextSelector selector;
    private final QueryExpander queryExpander;
    private final CompletionOrchestrator orchestrator;
    private final StructuredOutputParser parser;
    private final CreditSettlement settlement;
    private final UsageRecorder usage;
    private final RagMetrics metrics;
    private final int topK;
    private final int chunksPerSource;

    public FlashcardService(KeyResolver keyResolver,
                            EmbeddingBatcher batcher,
                            VectorIndexClient vectorIndex,
                            ContextSelector selector,
                            QueryExpander queryExpander,
                            CompletionOrchestrator orchestrator,
                            StructuredOutputParser parser,
                            CreditSettlement settlement,
                            UsageRecorder usage,
                            RagMetrics metrics,
                            @Value("${moonscribe.rag.retrieval.flashcards.topK:30}") int topK,
                            @Value("${moonscribe.rag.retrieval.flashcards.chunksPerSource:10}") int chunksPerSource) {
        this.keyResolver = keyResolver;
        this.batcher = batcher;
        this.vectorIndex = vectorIndex;
        this.selector = selector;
        this.queryExpander = queryExpander;
        this.orchestrator = orchestrator;
        this.parser = parser;
        this.settlement = settlement;
        this.usage = usage;
        this.metrics = metrics;
        this.topK = topK;
        this.chunksPerSource = chunksPerSource;
    }

    public FlashcardResponse generate(String userId, FlashcardRequest request) {
        request.validate();
        int count = request.getCountOrDefault();
        ProviderKind provider = ProviderKind.fromId(request.provider());
        CreditAction action = CreditAction.forCompletion(provider, orchestrator.resolveModel(provider, request.model(), provider));

        KeyResolution resolution = keyResolver.resolve(userId, request.apiKey(), provider, action);
        String keySource = resolution.keySource().id();

        Embedding queryEmbedding = batcher.embedOne(queryExpander.expand(RETRIEVAL_QUERY), keyResolver.embeddingKey(resolution));

        long searchStart = System.currentTimeMillis();
        List<String> filenames = request.sourceFilenames().stream().filter(s -> s != null && !s.isBlank()).collect(Collectors.toList());
        List<SearchHit> hits = vectorIndex.query(queryEmbedding.values(), topK,
                MetadataFilter.in(EmbeddingVector.SOURCE, filenames), true);
        metrics.recordVectorSearchTime(System.currentTimeMillis() - searchStart);

        ContextWindow window = selector.select(hits, chunksPerSource, topK);
        if (window.isEmpty()) {
            log.info("[FLASHCARDS] no relevant content in {}", filenames);
            metrics.recordRequest(resolution.keySource());
            return FlashcardResponse.noRelevantContent(keySource, resolution.teamName(),
                    resolution.balanceBefore(), queryEmbedding.tokensUsed());
        }

        Map<String, List<SearchHit>> bySource = window.bySource();
        int cardsPerSource = Math.max(MIN_CARDS_PER_SOURCE, count / bySource.size());
        int tokensUsed = queryEmbedding.tokensUsed();
        int completionTokens = 0;
        String modelUsed = null;
        ProviderKind providerUsed = provider;

        List<Flashcard> generated = new ArrayList<>();
        List<StructuredOutputException> parseFailures = new ArrayList<>();
        for (Map.Entry<String, List<SearchHit>> entry : bySource.entrySet()) {
            String sourceName = entry.getKey();
            ChatCompletion completion = orchestrator.complete(
                    buildPrompt(sourceName, entry.getValue(), cardsPerSource),
                    provider, request.model(), resolution.credential(), SETTINGS);
            tokensUsed += completion.tokensUsed();
            completionTokens += completion.tokensUsed();
            modelUsed = completion.model();
            providerUsed = completion.provider();

            ParseOutcome outcome = parser.parse(completion.text());
            if (outcome.isFailed()) {
                log.warn("[FLASHCARDS] could not parse flashcards for source '{}'", sourceName);
                parseFailures.add(new StructuredOutputException(
                        "Could not parse flashcards for source '" + sourceName + "'.", outcome.rawExcerpt()));
                continue;
            }
            for (JsonNode item : outcome.items()) {
                String front = item.path("front").asText("").trim();
                String back = item.path("back").asText("").trim();
                if (!front.isEmpty() && !back.isEmpty()) {
                    generated.add(new Flashcard(null, front, back, sourceName));
                }
            }
        }

        usage.record(userId, resolution.keySource(), providerUsed, modelUsed, UsageOperation.FLASHCARD, completionTokens);
        if (generated.isEmpty() && !parseFailures.isEmpty()) {
            throw parseFailures.get(0);
        }

        String batchId = Long.toString(System.currentTimeMillis());
        List<Flashcard> flashcards = new ArrayList<>();
        for (Flashcard card : generated.subList(0, Math.min(count, generated.size()))) {
            flashcards.add(new Flashcard("flashcard-" + batchId + "-" + flashcards.size(), card.front(), card.back(), card.source()));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("referenceType", "study-tools");
        metadata.put("model", modelUsed);
        metadata.put("tokens", tokensUsed);
        metadata.put("count", flashcards.size());
        metadata.put("sources", bySource.size());
        Integer remaining = settlement.settle(resolution,
                "Generated " + flashcards.size() + " flashcards from " + bySource.size() + " source(s)", metadata);

        Map<String, List<Flashcard>> grouped = new LinkedHashMap<>();
        for (String sourceName : bySource.keySet()) {
            grouped.put(sourceName, flashcards.stream().filter(f -> f.source().equals(sourceName)).collect(Collectors.toList()));
        }
        List<String> sources = new ArrayList<>(new LinkedHashSet<>(flashcards.stream().map(Flashcard::source).collect(Collectors.toList())));

        log.info("[FLASHCARDS] generated {} cards from {} sources ({} unparseable), keySource={}",
                flashcards.size(), bySource.size(), parseFailures.size(), keySource);
        return new FlashcardResponse(flashcards, sources, grouped, keySource, resolution.teamName(),
                remaining, tokensUsed, false);
    }

    static String buildPrompt(String sourceName, List<SearchHit> hits, int cardsPerSource) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < hits.size(); i++) {
            if (i > 0) context.append("\n\n");
            context.append('[').append(i + 1).append("] ").append(hits.get(i).text());
        }

        return """
                You are an expert educational content creator. Based on the provided context from a single document, generate %d high-quality flashcards.

                Each flashcard should:
                - Have a clear, concise question or term on the front
                - Have an accurate answer on the back
                - Cover important concepts, definitions, facts or key information from this document
                - Be based ONLY on the provided context

                Return your response as a JSON object with this exact structure:
                {
                  "flashcards": [
                    { "front": "Question or term", "back": "Answer or definition", "source": "%s" }
                  ]
                }

                CONTEXT FROM DOCUMENT "%s":
                %s

                Generate exactly %d flashcards from this document. Return ONLY the JSON object, no other text.""".formatted(
                cardsPerSource, sourceName, sourceName, context, cardsPerSource);
    }
}
