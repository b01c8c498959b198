package com.moonscribe.rag.dto;

/**
 * A numbered citation. {@code relevance} is the score as a whole percentage.
 */
public record SourceReference(int number, String source, long relevance) {}
