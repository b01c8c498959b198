package com.moonscribe.rag.repository;

import com.moonscribe.rag.entity.CreditAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface CreditAccountRepository extends JpaRepository<CreditAccount, String> {

    /**
     * Conditional decrement in a single statement. Returns the number of rows updated:
     * 1 when the balance covered the amount, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE CreditAccount a SET a.balance = a.balance - :amount, a.lifetimeUsed = a.lifetimeUsed + :amount, "
            + "a.updatedAt = :now WHERE a.userId = :userId AND a.balance >= :amount")
    int deductIfSufficient(@Param("userId") String userId, @Param("amount") int amount, @Param("now") LocalDateTime now);
}
