package com.moonscribe.rag.dto;

public record Flashcard(String id, String front, String back, String source) {}
