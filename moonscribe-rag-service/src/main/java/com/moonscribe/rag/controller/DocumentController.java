package com.moonscribe.rag.controller;

import com.moonscribe.rag.dto.DeleteSourceResponse;
import com.moonscribe.rag.dto.IngestRequest;
import com.moonscribe.rag.entity.DocumentRecord;
import com.moonscribe.rag.exception.RagPipelineException;
import com.moonscribe.rag.service.IngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/documents")
@Tag(name = "Documents", description = "Index extracted document text for retrieval")
@CrossOrigin(origins = "*")
public class DocumentController {
    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);

    private final IngestionService ingestionService;

    public DocumentController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping
    @Operation(summary = "Chunk, embed and index a document's extracted text")
    public ResponseEntity<?> ingest(
            @RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId,
            @RequestBody IngestRequest request) {
        try {
            return ResponseEntity.ok(ingestionService.ingest(userId, request));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        } catch (RagPipelineException e) {
            log.warn("[INGEST] failed at {} for source={}: {}", e.getStage(), request.source(), e.getMessage());
            return ErrorResponses.from(e);
        } catch (Exception e) {
            log.error("[INGEST] unexpected failure for source={}", request.source(), e);
            return ErrorResponses.internalError("Failed to process document");
        }
    }

    @GetMapping
    @Operation(summary = "Documents the signed-in user has ingested, newest first")
    public ResponseEntity<?> list(@RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId) {
        if (ErrorResponses.isAnonymous(userId)) {
            return ErrorResponses.unauthorized();
        }
        try {
            List<DocumentRecord> documents = ingestionService.listDocuments(userId);
            return ResponseEntity.ok(documents);
        } catch (Exception e) {
            log.error("[INGEST] failed to list documents of user {}", userId, e);
            return ErrorResponses.internalError("Failed to list documents");
        }
    }

    @DeleteMapping("/{source}")
    @Operation(summary = "Remove every indexed chunk of a source")
    public ResponseEntity<?> delete(
            @RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId,
            @PathVariable String source) {
        try {
            ingestionService.deleteSource(userId, source);
            return ResponseEntity.ok(new DeleteSourceResponse(true, source));
        } catch (IllegalArgumentException e) {
            return ErrorResponses.badRequest(e);
        } catch (RagPipelineException e) {
            log.warn("[INGEST] delete of source={} failed: {}", source, e.getMessage());
            return ErrorResponses.from(e);
        } catch (Exception e) {
            log.error("[INGEST] unexpected failure deleting source={}", source, e);
            return ErrorResponses.internalError("Failed to delete document");
        }
    }
}
