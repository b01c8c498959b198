package com.moonscribe.rag.exception;

/**
 * An embedding, completion or vector index call failed. The message names the stage and
 * the identifier involved (model, collection, source) and never contains credentials.
 */
public class UpstreamProviderException extends RagPipelineException {

    private final int statusCode;

    public UpstreamProviderException(String stage, String message) {
        this(stage, message, -1, null);
    }

    public UpstreamProviderException(String stage, String message, Throwable cause) {
        this(stage, message, -1, cause);
    }

    public UpstreamProviderException(String stage, String message, int statusCode, Throwable cause) {
        super(stage, message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the upstream, or -1 when the call did not complete. */
    public int getStatusCode() {
        return statusCode;
    }
}
