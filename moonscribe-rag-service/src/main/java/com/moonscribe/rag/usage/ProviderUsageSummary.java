package com.moonscribe.rag.usage;

public record ProviderUsageSummary(String provider, long totalTokens, double totalCost, int operationCount) {}
