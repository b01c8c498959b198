package com.moonscribe.rag.team;

import java.util.Optional;

public interface TeamKeyStore {

    /**
     * The usable shared key of the user's team: the team they own first, else the team they
     * are a member of. Empty when there is no team or the team has no usable key.
     */
    Optional<TeamKey> getTeamKey(String userId);
}
