package com.moonscribe.rag.config;

import com.moonscribe.rag.llm.ProviderCredential;
import com.moonscribe.rag.llm.ProviderKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Server-side provider settings. The api keys here back the credits tier.
 */
@Data
@Component
@ConfigurationProperties(prefix = "moonscribe.rag.providers")
public class ProviderProperties {

    private String defaultProvider = "openai";
    private int timeoutSeconds = 120;
    private Provider openai = new Provider("https://api.openai.com", "gpt-3.5-turbo");
    private Provider anthropic = new Provider("https://api.anthropic.com", "claude-3-sonnet-20240229");

    @Data
    public static class Provider {
        private String apiKey;
        private String baseUrl;
        private String defaultModel;

        public Provider() {
        }

        public Provider(String baseUrl, String defaultModel) {
            this.baseUrl = baseUrl;
            this.defaultModel = defaultModel;
        }
    }

    public ProviderKind defaultProviderKind() {
        return ProviderKind.fromId(defaultProvider);
    }

    public Provider provider(ProviderKind kind) {
        return switch (kind) {
            case OPENAI -> openai;
            case ANTHROPIC -> anthropic;
        };
    }

    public Optional<ProviderCredential> serverCredential(ProviderKind kind) {
        String key = provider(kind).getApiKey();
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ProviderCredential(kind, key));
    }
}
