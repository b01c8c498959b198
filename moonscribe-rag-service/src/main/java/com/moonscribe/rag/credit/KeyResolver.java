package com.moonscribe.rag.credit;

import com.moonscribe.rag.config.ProviderProperties;
import com.moonscribe.rag.exception.InsufficientCreditsException;
import com.moonscribe.rag.exception.MissingCredentialException;
import com.moonscribe.rag.llm.ProviderCredential;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.team.TeamKey;
import com.moonscribe.rag.team.TeamKeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decides which key serves a request: the caller's own key, then their team's shared key,
 * then the server key paid for with credits. Runs before any provider call.
 */
@Service
public class KeyResolver {
    private static final Logger log = LoggerFactory.getLogger(KeyResolver.class);

    private final CreditLedger ledger;
    private final TeamKeyStore teamKeys;
    private final ProviderProperties providers;

    public KeyResolver(CreditLedger ledger, TeamKeyStore teamKeys, ProviderProperties providers) {
        this.ledger = ledger;
        this.teamKeys = teamKeys;
        this.providers = providers;
    }

    public KeyResolution resolve(String userId, String byokKey, ProviderKind provider, CreditAction action) {
        return resolve(userId, byokKey, provider, action, 1);
    }

    /**
     * @param quantity number of action units the request consumes (pages for an upload)
     * @throws MissingCredentialException   when no tier yields a key
     * @throws InsufficientCreditsException when the caller's balance does not cover the cost
     */
    public KeyResolution resolve(String userId, String byokKey, ProviderKind provider, CreditAction action, int quantity) {
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be at least 1");
        }
        ProviderKind requested = provider == null ? providers.defaultProviderKind() : provider;

        if (byokKey != null && !byokKey.isBlank()) {
            log.info("[CREDITS] using caller-supplied key for {}", requested.id());
            return KeyResolution.byok(new ProviderCredential(requested, byokKey.trim()), blankToNull(userId));
        }

        if (userId != null && !userId.isBlank()) {
            Optional<TeamKey> teamKey = teamKeys.getTeamKey(userId);
            if (teamKey.isPresent()) {
                TeamKey key = teamKey.get();
                log.info("[CREDITS] using team key from team '{}'", key.teamName());
                return KeyResolution.team(new ProviderCredential(key.provider(), key.apiKey()), userId, key.teamName());
            }
        }

        if (userId == null || userId.isBlank()) {
            throw new MissingCredentialException("key-resolution",
                    "No API key available. Add your own API key, join a team, or sign in to use credits.", false);
        }

        ProviderCredential serverCredential = providers.serverCredential(requested)
                .or(() -> providers.serverCredential(providers.defaultProviderKind()))
                .orElseThrow(() -> new MissingCredentialException("key-resolution",
                        "No server API key is configured for " + requested.id() + ". Add your own API key or join a team.", true));

        int cost = Math.multiplyExact(ledger.getCost(action), quantity);
        int balance = ledger.getBalance(userId);
        if (balance < cost) {
            throw new InsufficientCreditsException(action, cost, balance);
        }
        log.info("[CREDITS] will deduct {} credits ({}) from user {} after success (balance {})",
                cost, action.id(), userId, balance);
        return KeyResolution.credits(serverCredential, userId, action, cost, balance);
    }

    /**
     * Key for embedding calls. Embeddings are always served by OpenAI: the resolved key when it
     * is an OpenAI key. The server's OpenAI key is only used in credits mode, where the request
     * is already billed.
     *
     * @throws MissingCredentialException when the caller's own or team key is not an OpenAI key,
     *                                    or the server has no OpenAI key in credits mode
     */
    public String embeddingKey(KeyResolution resolution) {
        ProviderCredential credential = resolution.credential();
        if (credential.provider() == ProviderKind.OPENAI) {
            return credential.apiKey();
        }
        if (resolution.keySource() != KeySource.CREDITS) {
            log.warn("[CREDITS] {} key for {} cannot embed; refusing to fall back to the server key",
                    resolution.keySource().id(), credential.provider().id());
            throw new MissingCredentialException("embedding",
                    "Embeddings need an OpenAI key. Use an OpenAI key or sign in to use credits.", false);
        }
        return providers.serverCredential(ProviderKind.OPENAI)
                .map(ProviderCredential::apiKey)
                .orElseThrow(() -> new MissingCredentialException("embedding",
                        "Embeddings need an OpenAI key and the server has none configured.", true));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
