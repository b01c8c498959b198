package com.moonscribe.rag.team;

import com.moonscribe.rag.entity.Team;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.repository.TeamMemberRepository;
import com.moonscribe.rag.repository.TeamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class JpaTeamKeyStore implements TeamKeyStore {
    private static final Logger log = LoggerFactory.getLogger(JpaTeamKeyStore.class);

    private final TeamRepository teams;
    private final TeamMemberRepository members;
    private final ApiKeyCipher cipher;

    public JpaTeamKeyStore(TeamRepository teams, TeamMemberRepository members, ApiKeyCipher cipher) {
        this.teams = teams;
        this.members = members;
        this.cipher = cipher;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TeamKey> getTeamKey(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }

        // An owned team decides on its own, membership elsewhere is not consulted.
        Optional<Team> owned = teams.findFirstByOwnerIdOrderByCreatedAtAsc(userId);
        if (owned.isPresent()) {
            return usableKey(owned.get());
        }

        return members.findFirstByUserIdOrderByJoinedAtAsc(userId)
                .flatMap(m -> teams.findById(m.getTeamId()))
                .flatMap(this::usableKey);
    }

    private Optional<TeamKey> usableKey(Team team) {
        String encrypted = team.getApiKeyEncrypted();
        if (encrypted == null || encrypted.isBlank()) {
            log.debug("[TEAM] team '{}' has no API key configured", team.getName());
            return Optional.empty();
        }
        if (!cipher.isConfigured()) {
            log.warn("[TEAM] team '{}' has a stored key but no encryption secret is configured", team.getName());
            return Optional.empty();
        }

        ProviderKind provider;
        try {
            provider = ProviderKind.fromId(team.getApiProvider());
        } catch (IllegalArgumentException e) {
            log.warn("[TEAM] team '{}' has unsupported provider '{}'", team.getName(), team.getApiProvider());
            return Optional.empty();
        }

        try {
            return Optional.of(new TeamKey(cipher.decrypt(encrypted), team.getName(), provider));
        } catch (IllegalArgumentException e) {
            log.error("[TEAM] failed to decrypt API key of team '{}': {}", team.getName(), e.getMessage());
            return Optional.empty();
        }
    }
}
