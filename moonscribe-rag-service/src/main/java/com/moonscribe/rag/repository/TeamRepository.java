package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.Team;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TeamRepository extends JpaRepository<Team, Long> {

    Optional<Team> findFirstByOwnerIdOrderByCreatedAtAsc(String ownerId);
}
