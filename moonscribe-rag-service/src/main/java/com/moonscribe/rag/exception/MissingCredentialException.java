package com.moonscribe.rag.exception;

/**
 * No tier produced a usable provider key, or a required setting is absent.
 * Raised before any paid upstream call.
 */
public class MissingCredentialException extends RagPipelineException {

    private final boolean serverMisconfigured;

    public MissingCredentialException(String stage, String message, boolean serverMisconfigured) {
        super(stage, message);
        this.serverMisconfigured = serverMisconfigured;
    }

    /**
     * True when the gap is on the server side (no key or index configured) rather than
     * something the caller can fix by supplying a key or signing in.
     */
    public boolean isServerMisconfigured() {
        return serverMisconfigured;
    }
}
