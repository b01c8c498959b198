package com.moonscribe.rag.dto;

public record DeleteSourceResponse(boolean success, String source) {}
