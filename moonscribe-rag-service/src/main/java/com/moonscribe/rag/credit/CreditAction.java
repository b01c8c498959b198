package com.moonscribe.rag.credit;

import com.moonscribe.rag.llm.ProviderKind;

import java.util.Locale;

/**
 * Billable actions and their default costs. Costs can be overridden per action in the
 * {@code credit_costs} table.
 */
public enum CreditAction {
    ASK_GPT35(1),
    ASK_GPT4(10),
    ASK_GPT4O(5),
    ASK_CLAUDE(5),
    UPLOAD_DOCUMENT_PAGE(1),
    PROCESS_YOUTUBE(2),
    PROCESS_WEB(1),
    TRANSCRIBE_AUDIO_MINUTE(3),
    EXPORT_INSIGHT(0);

    private final int defaultCost;

    CreditAction(int defaultCost) {
        this.defaultCost = defaultCost;
    }

    public int defaultCost() {
        return defaultCost;
    }

    /** Key used in the {@code credit_costs} table and in transaction rows, e.g. {@code ask_gpt4o}. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a completion request to the action it is billed as.
     */
    public static CreditAction forCompletion(ProviderKind provider, String model) {
        if (provider == ProviderKind.ANTHROPIC) {
            return ASK_CLAUDE;
        }
        String m = model == null ? "" : model.toLowerCase(Locale.ROOT);
        if (m.contains("gpt-4o")) {
            return ASK_GPT4O;
        }
        if (m.contains("gpt-4")) {
            return ASK_GPT4;
        }
        return ASK_GPT35;
    }
}
