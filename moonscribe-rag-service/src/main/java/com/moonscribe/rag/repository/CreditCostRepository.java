package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.CreditCostEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CreditCostRepository extends JpaRepository<CreditCostEntry, String> {

    Optional<CreditCostEntry> findByActionAndActiveTrue(String action);
}
