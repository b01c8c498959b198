package com.moonscribe.rag.credit;

import com.moonscribe.rag.metrics.RagMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Deducts the resolved cost once a request has produced its result. Never throws: a
 * failed deduction is logged and counted and the caller still gets the result.
 */
@Service
public class CreditSettlement {
    private static final Logger log = LoggerFactory.getLogger(CreditSettlement.class);

    private final CreditLedger ledger;
    private final RagMetrics metrics;

    public CreditSettlement(CreditLedger ledger, RagMetrics metrics) {
        this.ledger = ledger;
        this.metrics = metrics;
    }

    /**
     * @return the balance after deduction in credits mode, or null when no balance applies
     *         or the deduction failed
     */
    public Integer settle(KeyResolution resolution, String description, Map<String, Object> metadata) {
        metrics.recordRequest(resolution.keySource());
        if (resolution.keySource() != KeySource.CREDITS) {
            return null;
        }
        if (!resolution.requiresDeduction()) {
            return resolution.balanceBefore();
        }

        try {
            DeductionResult result = ledger.deduct(resolution.userId(), resolution.action(), resolution.cost(), description, metadata);
            if (result.success()) {
                metrics.recordCreditsDeducted(resolution.cost());
                log.info("[CREDITS] deducted {} credits from user {}, remaining {}",
                        resolution.cost(), resolution.userId(), result.newBalance());
                return result.newBalance();
            }
            metrics.recordDeductionFailure();
            log.warn("[CREDITS] deduction of {} credits for user {} failed: {}",
                    resolution.cost(), resolution.userId(), result.error());
            return null;
        } catch (RuntimeException e) {
            metrics.recordDeductionFailure();
            log.error("[CREDITS] deduction of {} credits for user {} raised an error", resolution.cost(), resolution.userId(), e);
            return null;
        }
    }
}
