package com.moonscribe.rag.credit;

public record DeductionResult(boolean success, int newBalance, String error) {

    public static DeductionResult success(int newBalance) {
        return new DeductionResult(true, newBalance, null);
    }

    public static DeductionResult failed(int balance, String error) {
        return new DeductionResult(false, balance, error);
    }
}
