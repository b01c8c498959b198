package com.moonscribe.rag.llm;

import com.moonscribe.rag.exception.MissingCredentialException;
import com.moonscribe.rag.metrics.RagMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a prompt to the adapter for the credential's provider.
 *
 * The requested provider and model are honored when the credential belongs to that provider.
 * Otherwise the call goes to the credential's provider with that provider's default model.
 */
public class CompletionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CompletionOrchestrator.class);

    private final Map<ProviderKind, ChatClient> clients = new EnumMap<>(ProviderKind.class);
    private final Map<ProviderKind, String> defaultModels;
    private final RagMetrics metrics;

    public CompletionOrchestrator(List<ChatClient> clients, Map<ProviderKind, String> defaultModels, RagMetrics metrics) {
        for (ChatClient client : clients) {
            this.clients.put(client.provider(), client);
        }
        this.defaultModels = new EnumMap<>(defaultModels);
        this.metrics = metrics;
    }

    public ChatCompletion complete(String prompt, ProviderKind requested, String model,
                                   ProviderCredential credential, CompletionSettings settings) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        ProviderKind provider = credential.provider();
        String effectiveModel = resolveModel(requested, model, provider);
        if (requested != null && requested != provider) {
            log.warn("[COMPLETION] requested provider {} but credential is for {}; using {} with model {}",
                    requested.id(), provider.id(), provider.id(), effectiveModel);
            metrics.recordProviderFallback();
        }

        ChatClient client = clients.get(provider);
        if (client == null) {
            throw new MissingCredentialException("completion", "No completion client configured for provider " + provider.id(), true);
        }

        long start = System.currentTimeMillis();
        ChatCompletion completion = client.complete(prompt, effectiveModel, settings, credential.apiKey());
        long elapsed = System.currentTimeMillis() - start;
        metrics.recordCompletionTime(elapsed);
        log.info("[TIMING] completion provider={} model={} took {}ms tokens={}",
                provider.id(), effectiveModel, elapsed, completion.tokensUsed());
        return completion;
    }

    /**
     * The model a call will use: the requested one when the credential matches the requested
     * provider and a model was named, else the default model of the credential's provider.
     */
    public String resolveModel(ProviderKind requested, String model, ProviderKind credentialProvider) {
        boolean matches = requested == null || requested == credentialProvider;
        if (matches && model != null && !model.isBlank()) {
            return model;
        }
        return defaultModel(credentialProvider);
    }

    public String defaultModel(ProviderKind provider) {
        String model = defaultModels.get(provider);
        if (model == null || model.isBlank()) {
            throw new MissingCredentialException("completion", "No default model configured for provider " + provider.id(), true);
        }
        return model;
    }
}
