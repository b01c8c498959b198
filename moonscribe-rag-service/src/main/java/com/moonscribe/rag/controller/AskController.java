package com.moonscribe.rag.controller;

import com.moonscribe.rag.dto.AskRequest;
import com.moonscribe.rag.exception.RagPipelineException;
import com.moonscribe.rag.service.AskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/ask")
@Tag(name = "Ask", description = "Question answering over uploaded documents")
@CrossOrigin(origins = "*")
public class AskController {
    private static final Logger log = LoggerFactory.getLogger(AskController.class);

    private final AskService askService;

    public AskController(AskService askService) {
        this.askService = askService;
    }

    @PostMapping
    @Operation(summary = "Answer a question with numbered source citations")
    public ResponseEntity<?> ask(
            @RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId,
            @RequestBody AskRequest request) {
        try {
            return ResponseEntity.ok(askService.ask(userId, request));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        } catch (RagPipelineException e) {
            log.warn("[ASK] failed at {}: {}", e.getStage(), e.getMessage());
            return ErrorResponses.from(e);
        } catch (Exception e) {
            log.error("[ASK] unexpected failure", e);
            return ErrorResponses.internalError("Failed to answer question");
        }
    }
}
