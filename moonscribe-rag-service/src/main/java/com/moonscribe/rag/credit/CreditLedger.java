package com.moonscribe.rag.credit;

import java.util.Map;

/**
 * Per-user credit balances. Balances change only through {@link #deduct} and {@link #add}.
 */
public interface CreditLedger {

    /** Current balance, 0 for a user without an account. */
    int getBalance(String userId);

    /** Cost of one unit of the action. */
    int getCost(CreditAction action);

    /**
     * Removes {@code amount} credits if and only if the balance covers it, as one atomic step.
     * A balance that no longer covers the amount yields an unsuccessful result rather than an
     * exception.
     */
    DeductionResult deduct(String userId, CreditAction action, int amount, String description, Map<String, Object> metadata);

    /** Adds credits and returns the new balance. */
    int add(String userId, int amount, String description);
}
