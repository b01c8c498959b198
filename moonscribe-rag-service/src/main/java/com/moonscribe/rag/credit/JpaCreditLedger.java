package com.moonscribe.rag.credit;

import com.moonscribe.rag.entity.CreditAccount;
import com.moonscribe.rag.entity.CreditTransaction;
import com.moonscribe.rag.json.Json;
import com.moonscribe.rag.repository.CreditAccountRepository;
import com.moonscribe.rag.repository.CreditCostRepository;
import com.moonscribe.rag.repository.CreditTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Credit ledger backed by the {@code credits}, {@code credit_costs} and
 * {@code credit_transactions} tables.
 */
@Service
public class JpaCreditLedger implements CreditLedger {
    private static final Logger log = LoggerFactory.getLogger(JpaCreditLedger.class);

    private final CreditAccountRepository accounts;
    private final CreditCostRepository costs;
    private final CreditTransactionRepository transactions;

    public JpaCreditLedger(CreditAccountRepository accounts,
                           CreditCostRepository costs,
                           CreditTransactionRepository transactions) {
        this.accounts = accounts;
        this.costs = costs;
        this.transactions = transactions;
    }

    @Override
    @Transactional(readOnly = true)
    public int getBalance(String userId) {
        return accounts.findById(userId).map(CreditAccount::getBalance).orElse(0);
    }

    @Override
    @Transactional(readOnly = true)
    public int getCost(CreditAction action) {
        return costs.findByActionAndActiveTrue(action.id())
                .map(entry -> entry.getCreditsCost())
                .orElse(action.defaultCost());
    }

    @Override
    @Transactional
    public DeductionResult deduct(String userId, CreditAction action, int amount, String description, Map<String, Object> metadata) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
        if (amount == 0) {
            return DeductionResult.success(getBalance(userId));
        }

        int updated = accounts.deductIfSufficient(userId, amount, LocalDateTime.now());
        if (updated == 0) {
            int balance = getBalance(userId);
            log.warn("[CREDITS] deduction of {} for {} rejected, balance {}", amount, action.id(), balance);
            return DeductionResult.failed(balance, "Insufficient credits");
        }

        int newBalance = getBalance(userId);
        transactions.save(CreditTransaction.builder()
                .userId(userId)
                .amount(-amount)
                .balanceAfter(newBalance)
                .type(action.id())
                .description(description)
                .referenceType(referenceType(metadata))
                .metadata(toJson(metadata))
                .build());
        return DeductionResult.success(newBalance);
    }

    @Override
    @Transactional
    public int add(String userId, int amount, String description) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        CreditAccount account = accounts.findById(userId)
                .orElseGet(() -> CreditAccount.builder().userId(userId).build());
        account.setBalance(account.getBalance() + amount);
        account.setLifetimePurchased(account.getLifetimePurchased() + amount);
        accounts.save(account);

        transactions.save(CreditTransaction.builder()
                .userId(userId)
                .amount(amount)
                .balanceAfter(account.getBalance())
                .type("purchase")
                .description(description)
                .build());
        return account.getBalance();
    }

    private static String referenceType(Map<String, Object> metadata) {
        Object value = metadata == null ? null : metadata.get("referenceType");
        return value == null ? null : value.toString();
    }

    private static String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        return Json.tryWrite(metadata).orElseGet(() -> {
            log.warn("[CREDITS] could not serialize transaction metadata with keys {}", metadata.keySet());
            return null;
        });
    }
}
