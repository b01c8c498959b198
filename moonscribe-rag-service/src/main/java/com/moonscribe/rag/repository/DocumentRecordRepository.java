package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.DocumentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, String> {

    List<DocumentRecord> findByUserIdOrderByCreatedAtDesc(String userId);

    List<DocumentRecord> findByUserIdAndFilename(String userId, String filename);
}
