package com.moonscribe.rag.controller;

import com.moonscribe.rag.dto.ErrorResponse;
import com.moonscribe.rag.exception.InsufficientCreditsException;
import com.moonscribe.rag.exception.MissingCredentialException;
import com.moonscribe.rag.exception.RagPipelineException;
import com.moonscribe.rag.exception.StructuredOutputException;
import com.moonscribe.rag.exception.UpstreamProviderException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps pipeline failures to HTTP responses.
 */
final class ErrorResponses {

    static final String USER_HEADER = "X-User-Id";

    private ErrorResponses() {}

    static ResponseEntity<ErrorResponse> from(RagPipelineException e) {
        if (e instanceof InsufficientCreditsException) {
            InsufficientCreditsException ice = (InsufficientCreditsException) e;
            return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED)
                    .body(new ErrorResponse(ice.getMessage(), ice.getStage(), ice.getRequired(), ice.getBalance()));
        }
        if (e instanceof MissingCredentialException) {
            HttpStatus status = ((MissingCredentialException) e).isServerMisconfigured()
                    ? HttpStatus.SERVICE_UNAVAILABLE
                    : HttpStatus.UNAUTHORIZED;
            return ResponseEntity.status(status).body(ErrorResponse.of(e.getMessage(), e.getStage()));
        }
        if (e instanceof UpstreamProviderException || e instanceof StructuredOutputException) {
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of(e.getMessage(), e.getStage()));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(e.getMessage(), e.getStage()));
    }

    static ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("Validation error: " + e.getMessage()));
    }

    static ResponseEntity<ErrorResponse> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of("Unauthorized. Please sign in."));
    }

    static boolean isAnonymous(String userId) {
        return userId == null || userId.isBlank();
    }

    static ResponseEntity<ErrorResponse> internalError(String what) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(what));
    }
}
