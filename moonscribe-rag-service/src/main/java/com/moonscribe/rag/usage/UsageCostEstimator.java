package com.moonscribe.rag.usage;

import com.moonscribe.rag.llm.ProviderKind;

import java.util.Map;

/**
 * Rough provider cost in USD from a token count. Completion tokens are split 80/20 between
 * input and output since the providers report only a total here.
 */
public final class UsageCostEstimator {

    static final String EMBEDDING_MODEL = "text-embedding-3-large";
    static final String DEFAULT_OPENAI_MODEL = "gpt-3.5-turbo";
    static final String DEFAULT_ANTHROPIC_MODEL = "claude-3-sonnet-20240229";

    private static final double EMBEDDING_RATE = 0.00013 / 1000;

    private record Rates(double input, double output) {}

    private static final Map<String, Rates> OPENAI = Map.of(
            "gpt-3.5-turbo", new Rates(0.0005 / 1000, 0.0015 / 1000),
            "gpt-4-turbo", new Rates(0.01 / 1000, 0.03 / 1000),
            "gpt-4", new Rates(0.03 / 1000, 0.06 / 1000));

    private static final Map<String, Rates> ANTHROPIC = Map.of(
            "claude-3-opus-20240229", new Rates(0.015 / 1000, 0.075 / 1000),
            "claude-3-sonnet-20240229", new Rates(0.003 / 1000, 0.015 / 1000),
            "claude-3-haiku-20240307", new Rates(0.00025 / 1000, 0.00125 / 1000));

    private UsageCostEstimator() {}

    public static double estimate(ProviderKind provider, UsageOperation operation, int tokens, String model) {
        if (tokens <= 0) {
            return 0.0;
        }
        if (operation == UsageOperation.EMBEDDING) {
            return tokens * EMBEDDING_RATE;
        }
        Rates rates = provider == ProviderKind.ANTHROPIC
                ? ANTHROPIC.getOrDefault(model == null ? "" : model, ANTHROPIC.get(DEFAULT_ANTHROPIC_MODEL))
                : OPENAI.getOrDefault(model == null ? "" : model, OPENAI.get(DEFAULT_OPENAI_MODEL));
        long inputTokens = (long) Math.floor(tokens * 0.8);
        long outputTokens = (long) Math.floor(tokens * 0.2);
        return inputTokens * rates.input() + outputTokens * rates.output();
    }
}
