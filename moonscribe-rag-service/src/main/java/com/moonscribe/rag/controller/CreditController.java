package com.moonscribe.rag.controller;

import com.moonscribe.rag.credit.CreditLedger;
import com.moonscribe.rag.dto.BalanceResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/credits")
@Tag(name = "Credits", description = "Credit balance of the signed-in user")
@CrossOrigin(origins = "*")
public class CreditController {

    private final CreditLedger ledger;

    public CreditController(CreditLedger ledger) {
        this.ledger = ledger;
    }

    @GetMapping("/balance")
    @Operation(summary = "Current credit balance")
    public ResponseEntity<?> balance(@RequestHeader(value = ErrorResponses.USER_HEADER, required = false) String userId) {
        if (ErrorResponses.isAnonymous(userId)) {
            return ErrorResponses.unauthorized();
        }
        return ResponseEntity.ok(new BalanceResponse(userId, ledger.getBalance(userId)));
    }
}
