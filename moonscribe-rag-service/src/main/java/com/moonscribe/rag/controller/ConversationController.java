package com.moonscribe.rag.controller;

import com.moonscribe.rag.conversation.ConversationStore;
import com.moonscribe.rag.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/conversations")
@Tag(name = "Conversations", description = "Saved question and answer history")
@CrossOrigin(origins = "*")
public class ConversationController {

    private final ConversationStore conversations;

    public ConversationController(ConversationStore conversations) {
        this.conversations = conversations;
    }

    @GetMapping
    @Operation(summary = "Conversations of the signed-in user, most recently updated first")
    public ResponseEntity<?> list(@RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId) {
        if (ErrorResponses.isAnonymous(userId)) {
            return ErrorResponses.unauthorized();
        }
        return ResponseEntity.ok(conversations.list(userId));
    }

    @GetMapping("/{id}")
    @Operation(summary = "A conversation with its messages in order")
    public ResponseEntity<?> get(
            @RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId,
            @PathVariable Long id) {
        if (ErrorResponses.isAnonymous(userId)) {
            return ErrorResponses.unauthorized();
        }
        return conversations.thread(userId, id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.of("Conversation not found: " + id)));
    }
}
