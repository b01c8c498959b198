package com.moonscribe.rag.controller;

import com.moonscribe.rag.usage.UsageRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/usage")
@Tag(name = "Usage", description = "Provider usage and estimated cost of the signed-in user")
@CrossOrigin(origins = "*")
public class UsageController {

    private final UsageRecorder usage;

    public UsageController(UsageRecorder usage) {
        this.usage = usage;
    }

    @GetMapping("/summary")
    @Operation(summary = "This month's tokens and estimated cost per provider")
    public ResponseEntity<?> summary(@RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId) {
        if (ErrorResponses.isAnonymous(userId)) {
            return ErrorResponses.unauthorized();
        }
        return ResponseEntity.ok(usage.monthlySummary(userId));
    }
}
