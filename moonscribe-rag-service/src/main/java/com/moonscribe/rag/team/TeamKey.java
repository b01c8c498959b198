package com.moonscribe.rag.team;

import com.moonscribe.rag.llm.ProviderKind;

/**
 * A team's decrypted shared provider key.
 */
public record TeamKey(String apiKey, String teamName, ProviderKind provider) {

    @Override
    public String toString() {
        return "TeamKey[teamName=" + teamName + ", provider=" + provider + ", apiKey=****]";
    }
}
