package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.TeamMember;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TeamMemberRepository extends JpaRepository<TeamMember, Long> {

    Optional<TeamMember> findFirstByUserIdOrderByJoinedAtAsc(String userId);
}
