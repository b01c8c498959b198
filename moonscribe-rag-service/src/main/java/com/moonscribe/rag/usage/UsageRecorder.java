package com.moonscribe.rag.usage;

import com.moonscribe.rag.credit.KeySource;
import com.moonscribe.rag.entity.UsageLog;
import com.moonscribe.rag.llm.ProviderKind;
import com.moonscribe.rag.repository.UsageLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-operation usage log of signed-in callers. A failed write is logged and never fails the
 * request that caused it.
 */
@Service
public class UsageRecorder {
    private static final Logger log = LoggerFactory.getLogger(UsageRecorder.class);

    private final UsageLogRepository repository;

    public UsageRecorder(UsageLogRepository repository) {
        this.repository = repository;
    }

    public Optional<UsageLog> record(String userId, KeySource keySource, ProviderKind provider, String model,
                                     UsageOperation operation, int tokensUsed) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        double cost = UsageCostEstimator.estimate(provider, operation, tokensUsed, model);
        UsageLog entry = UsageLog.builder()
                .userId(userId)
                .provider(provider.id())
                .model(model)
                .operation(operation.id())
                .keySource(keySource == null ? null : keySource.id())
                .tokensUsed(tokensUsed)
                .costEstimate(cost)
                .build();
        try {
            UsageLog saved = repository.save(entry);
            log.debug("[USAGE] {} {} tokens={} cost=${} for user {}", provider.id(), operation.id(), tokensUsed, cost, userId);
            return Optional.of(saved);
        } catch (DataAccessException e) {
            log.warn("[USAGE] could not log {} usage for user {}: {}", operation.id(), userId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Usage since the first day of the current month, one row per provider ordered by name.
     */
    public List<ProviderUsageSummary> monthlySummary(String userId) {
        LocalDateTime since = LocalDate.now().withDayOfMonth(1).atStartOfDay();
        Map<String, long[]> tokensAndCount = new TreeMap<>();
        Map<String, Double> costs = new TreeMap<>();
        for (UsageLog entry : repository.findByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(userId, since)) {
            long[] acc = tokensAndCount.computeIfAbsent(entry.getProvider(), p -> new long[2]);
            acc[0] += entry.getTokensUsed();
            acc[1]++;
            costs.merge(entry.getProvider(), entry.getCostEstimate(), Double::sum);
        }
        List<ProviderUsageSummary> out = new ArrayList<>(tokensAndCount.size());
        for (Map.Entry<String, long[]> e : tokensAndCount.entrySet()) {
            out.add(new ProviderUsageSummary(e.getKey(), e.getValue()[0], costs.get(e.getKey()), (int) e.getValue()[1]));
        }
        return out;
    }
}
