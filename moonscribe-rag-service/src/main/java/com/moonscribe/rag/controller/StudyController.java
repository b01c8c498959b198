package com.moonscribe.rag.controller;

import com.moonscribe.rag.dto.FlashcardRequest;
import com.moonscribe.rag.exception.RagPipelineException;
import com.moonscribe.rag.service.FlashcardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/study")
@Tag(name = "Study tools", description = "Study artifacts generated from uploaded documents")
@CrossOrigin(origins = "*")
public class StudyController {
    private static final Logger log = LoggerFactory.getLogger(StudyController.class);

    private final FlashcardService flashcardService;

    public StudyController(FlashcardService flashcardService) {
        this.flashcardService = flashcardService;
    }

    @PostMapping("/flashcards")
    @Operation(summary = "Generate flashcards from selected sources")
    public ResponseEntity<?> flashcards(
            @RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId,
            @RequestBody FlashcardRequest request) {
        try {
            return ResponseEntity.ok(flashcardService.generate(userId, request));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        } catch (RagPipelineException e) {
            log.warn("[FLASHCARDS] failed at {}: {}", e.getStage(), e.getMessage());
            return ErrorResponses.from(e);
        } catch (Exception e) {
            log.error("[FLASHCARDS] unexpected failure", e);
            return ErrorResponses.internalError("Failed to generate flashcards");
        }
    }
}
