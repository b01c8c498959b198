package com.moonscribe.rag.exception;

/**
 * Base class for failures raised by the pipeline. Carries the stage that failed
 * (for example {@code embedding}, {@code vector-query}, {@code completion}) so callers can
 * report where a request broke without inspecting the cause chain.
 */
public abstract class RagPipelineException extends RuntimeException {

    private final String stage;

    protected RagPipelineException(String stage, String message) {
        super(message);
        this.stage = stage;
    }

    protected RagPipelineException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
