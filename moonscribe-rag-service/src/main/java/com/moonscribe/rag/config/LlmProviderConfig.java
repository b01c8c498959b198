package com.moonscribe.rag.config;

import com.moonscribe.rag.http.Http;
import com.moonscribe.rag.llm.ChatClient;
import com.moonscribe.rag.llm.CompletionOrchestrator;
import com.moonscribe.rag.llm.EmbeddingsClient;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.llm.anthropic.AnthropicChatClient;
import com.moonscribe.rag.llm.openai.OpenAIChatClient;
import com.moonscribe.rag.llm.openai.OpenAIEmbeddingsClient;
import com.moonscribe.rag.metrics.RagMetrics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
public class LlmProviderConfig {

    @Bean
    public HttpClient ragHttpClient(@Value("${moonscribe.rag.http.connectTimeoutSeconds:10}") int connectTimeoutSeconds) {
        return Http.newClient(Duration.ofSeconds(connectTimeoutSeconds));
    }

    @Bean
    public EmbeddingsClient openAIEmbeddingsClient(
            HttpClient ragHttpClient,
            ProviderProperties providers,
            @Value("${moonscribe.rag.embedding.model:text-embedding-3-large}") String model
    ) {
        return new OpenAIEmbeddingsClient(ragHttpClient, providers.getOpenai().getBaseUrl(), model,
                Duration.ofSeconds(providers.getTimeoutSeconds()));
    }

    @Bean
    public ChatClient openAIChatClient(HttpClient ragHttpClient, ProviderProperties providers) {
        return new OpenAIChatClient(ragHttpClient, providers.getOpenai().getBaseUrl(),
                Duration.ofSeconds(providers.getTimeoutSeconds()));
    }

    @Bean
    public ChatClient anthropicChatClient(HttpClient ragHttpClient, ProviderProperties providers) {
        return new AnthropicChatClient(ragHttpClient, providers.getAnthropic().getBaseUrl(),
                Duration.ofSeconds(providers.getTimeoutSeconds()));
    }

    @Bean
    public CompletionOrchestrator completionOrchestrator(List<ChatClient> chatClients, ProviderProperties providers, RagMetrics metrics) {
        Map<ProviderKind, String> defaultModels = new EnumMap<>(ProviderKind.class);
        for (ProviderKind kind : ProviderKind.values()) {
            defaultModels.put(kind, providers.provider(kind).getDefaultModel());
        }
        return new CompletionOrchestrator(chatClients, defaultModels, metrics);
    }
}
