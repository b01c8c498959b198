package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.UsageLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface UsageLogRepository extends JpaRepository<UsageLog, Long> {

    List<UsageLog> findByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(String userId, LocalDateTime since);
}
