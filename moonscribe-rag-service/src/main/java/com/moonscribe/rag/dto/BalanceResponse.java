package com.moonscribe.rag.dto;

public record BalanceResponse(String userId, int balance) {}
