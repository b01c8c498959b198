package com.moonscribe.rag.exception;

public class StructuredOutputException extends RagPipelineException {

    private final String rawExcerpt;

    public StructuredOutputException(String message, String rawExcerpt) {
        super("parse", message + " Raw response starts with: " + rawExcerpt);
        this.rawExcerpt = rawExcerpt;
    }

    public String getRawExcerpt() {
        return rawExcerpt;
    }
}
