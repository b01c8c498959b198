package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, Long> {

    List<Conversation> findByUserIdOrderByUpdatedAtDesc(String userId);

    Optional<Conversation> findByIdAndUserId(Long id, String userId);
}
