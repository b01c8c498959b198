package com.moonscribe.rag.service;

import com.moonscribe.rag.context.ContextSelector;
import com.moonscribe.rag.context.ContextWindow;
import com.moonscribe.rag.conversation.ConversationStore;
import com.moonscribe.rag.credit.CreditAction;
import com.moonscribe.rag.credit.CreditSettlement;
import com.moonscribe.rag.credit.KeyResolution;
import com.moonscribe.rag.credit.KeyResolver;
import com.moonscribe.rag.dto.AskRequest;
import com.moonscribe.rag.dto.AskResponse;
import com.moonscribe.rag.dto.SourceReference;
import com.moonscribe.rag.ingest.EmbeddingBatcher;
import com.moonscribe.rag.llm.ChatCompletion;
import com.moonscribe.rag.llm.CompletionOrchestrator;
import com.moonscribe.rag.llm.CompletionSettings;
import com.moonscribe.rag.llm.Embedding;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.metrics.RagMetrics;
import com.moonscribe.rag.usage.UsageCostEstimator;
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
import java.util.List;
import java.util.Map;

/**
 * Answers a question from the caller's documents with numbered citations.
 */
@Service
public class AskService {
    private static final Logger log = LoggerFactory.getLogger(AskService.class);

    private static final CompletionSettings SETTINGS = CompletionSettings.text(0.3, 2000);

    private final KeyResolver keyResolver;
    private final EmbeddingBatcher batcher;
    private final VectorIndexClient vectorIndex;
    private final ContextSelector selector;
    private final CompletionOrchestrator orchestrator;
    private final CreditSettlement settlement;
    private final ConversationStore conversations;
    private final UsageRecorder usage;
    private final RagMetrics metrics;
    private final int topK;

    public AskService(KeyResolver keyResolver,
                      EmbeddingBatcher batcher,
                      VectorIndexClient vectorIndex,
                      ContextSelector selector,
                      CompletionOrchestrator orchestrator,
                      CreditSettlement settlement,
                      ConversationStore conversations,
                      UsageRecorder usage,
                      RagMetrics metrics,
                      @Value("${moonscribe.rag.retrieval.ask.topK:25}") int topK) {
        this.keyResolver = keyResolver;
        this.batcher = batcher;
        this.vectorIndex = vectorIndex;
        this.selector = selector;
        this.orchestrator = orchestrator;
        this.settlement = settlement;
        this.conversations = conversations;
        this.usage = usage;
        this.metrics = metrics;
        this.topK = topK;
    }

    public AskResponse ask(String userId, AskRequest request) {
        request.validate();
        ProviderKind provider = ProviderKind.fromId(request.provider());
        CreditAction action = CreditAction.forCompletion(provider, orchestrator.resolveModel(provider, request.model(), provider));

        KeyResolution resolution = keyResolver.resolve(userId, request.apiKey(), provider, action);
        String keySource = resolution.keySource().id();

        Embedding questionEmbedding = batcher.embedOne(request.question(), keyResolver.embeddingKey(resolution));

        long searchStart = System.currentTimeMillis();
        List<SearchHit> hits = vectorIndex.query(questionEmbedding.values(), topK, filterFor(request), true);
        metrics.recordVectorSearchTime(System.currentTimeMillis() - searchStart);

        ContextWindow window = selector.select(hits);
        if (window.isEmpty()) {
            log.info("[ASK] no relevant content among {} hits", hits.size());
            metrics.recordRequest(resolution.keySource());
            return AskResponse.noRelevantContent(keySource, resolution.teamName(),
                    resolution.balanceBefore(), questionEmbedding.tokensUsed(), request.conversationId());
        }

        ChatCompletion completion = orchestrator.complete(
                buildPrompt(request.question(), window), provider, request.model(), resolution.credential(), SETTINGS);
        int tokensUsed = completion.tokensUsed() + questionEmbedding.tokensUsed();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("referenceType", "ask");
        metadata.put("model", completion.model());
        metadata.put("tokens", tokensUsed);
        Integer remaining = settlement.settle(resolution, "Asked: " + abbreviate(request.question(), 50), metadata);

        List<SourceReference> sources = new ArrayList<>(window.size());
        for (int i = 0; i < window.size(); i++) {
            SearchHit hit = window.hits().get(i);
            sources.add(new SourceReference(i + 1, window.canonicalName(hit.source()), Math.round(hit.score() * 100)));
        }

        double chatCost = UsageCostEstimator.estimate(completion.provider(), UsageOperation.CHAT,
                completion.tokensUsed(), completion.model());
        usage.record(userId, resolution.keySource(), completion.provider(), completion.model(),
                UsageOperation.CHAT, completion.tokensUsed());
        Long conversationId = saveExchange(userId, request, completion, sources, chatCost);

        log.info("[ASK] answered from {} chunks of {} sources, provider={} keySource={}",
                window.size(), window.sourceNames().size(), completion.provider().id(), keySource);
        return new AskResponse(completion.text(), sources, keySource, resolution.teamName(),
                remaining, tokensUsed, false, conversationId);
    }

    private Long saveExchange(String userId, AskRequest request, ChatCompletion completion,
                              List<SourceReference> sources, double chatCost) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        try {
            return conversations.recordExchange(userId, request.conversationId(), request.question(),
                    completion.text(), sources, completion.model(), completion.tokensUsed(), chatCost);
        } catch (RuntimeException e) {
            log.warn("[ASK] could not save conversation for user {}: {}", userId, e.getMessage());
            return request.conversationId();
        }
    }

    static MetadataFilter filterFor(AskRequest request) {
        List<String> filenames = request.getSourceFilenamesOrEmpty();
        if (!filenames.isEmpty()) {
            return MetadataFilter.in(EmbeddingVector.SOURCE, filenames);
        }
        List<String> documentIds = request.getDocumentIdsOrEmpty();
        if (!documentIds.isEmpty()) {
            return MetadataFilter.in(EmbeddingVector.DOCUMENT_ID, documentIds);
        }
        return MetadataFilter.none();
    }

    static String buildPrompt(String question, ContextWindow window) {
        StringBuilder context = new StringBuilder();
        List<SearchHit> hits = window.hits();
        for (int i = 0; i < hits.size(); i++) {
            if (i > 0) context.append("\n\n");
            context.append('[').append(i + 1).append("] From ").append(window.canonicalName(hits.get(i).source())).append(":\n")
                    .append(hits.get(i).text());
        }

        List<String> names = window.sourceNames();
        String sourceList = names.size() > 1
                ? "You have context from " + names.size() + " different documents: " + String.join(", ", names) + ".\n"
                : "";

        return """
                You are an expert research assistant. Analyze the provided context and give a comprehensive, well-structured answer to the question.

                %sINSTRUCTIONS:
                - Synthesize the information from the context into a detailed answer
                - Structure the answer with an introduction, main points and a conclusion
                - Cite sources as [1], [2], etc. when using specific information
                - Address each aspect the question asks about
                - If information is missing or unclear, say so

                CONTEXT FROM DOCUMENTS:
                %s

                QUESTION: %s

                Answer:""".formatted(sourceList, context, question);
    }

    private static String abbreviate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max) + "...";
    }
}
