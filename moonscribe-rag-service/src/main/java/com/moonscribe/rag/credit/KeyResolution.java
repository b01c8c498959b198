package com.moonscribe.rag.credit;

import com.moonscribe.rag.llm.ProviderCredential;

/**
 * Outcome of key resolution: the credential to call providers with and, in credits mode,
 * the cost to deduct once the request has succeeded.
 *
 * @param teamName       set for {@link KeySource#TEAM} only
 * @param userId         the caller, null for anonymous BYOK requests
 * @param action         billed action, null outside credits mode
 * @param cost           credits to deduct after success, 0 outside credits mode
 * @param balanceBefore  balance observed at resolution time, null outside credits mode
 */
public record KeyResolution(KeySource keySource,
                            ProviderCredential credential,
                            String teamName,
                            String userId,
                            CreditAction action,
                            int cost,
                            Integer balanceBefore) {

    public static KeyResolution byok(ProviderCredential credential, String userId) {
        return new KeyResolution(KeySource.BYOK, credential, null, userId, null, 0, null);
    }

    public static KeyResolution team(ProviderCredential credential, String userId, String teamName) {
        return new KeyResolution(KeySource.TEAM, credential, teamName, userId, null, 0, null);
    }

    public static KeyResolution credits(ProviderCredential credential, String userId, CreditAction action, int cost, int balance) {
        return new KeyResolution(KeySource.CREDITS, credential, null, userId, action, cost, balance);
    }

    public boolean requiresDeduction() {
        return keySource == KeySource.CREDITS && cost > 0;
    }
}
