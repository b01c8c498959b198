package com.moonscribe.rag.exception;

import com.moonscribe.rag.credit.CreditAction;

public class InsufficientCreditsException extends RagPipelineException {

    private final CreditAction action;
    private final int required;
    private final int balance;

    public InsufficientCreditsException(CreditAction action, int required, int balance) {
        super("credit-check", "Insufficient credits. Need " + required + " credits but only have " + balance
                + ". Buy more credits, use your own API key, or join a team.");
        this.action = action;
        this.required = required;
        this.balance = balance;
    }

    public CreditAction getAction() {
        return action;
    }

    public int getRequired() {
        return required;
    }

    public int getBalance() {
        return balance;
    }
}
