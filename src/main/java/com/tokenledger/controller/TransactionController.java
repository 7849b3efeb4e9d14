package com.tokenledger.controller;

import com.tokenledger.dto.ApiResponses;
import com.tokenledger.service.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.NoSuchElementException;

/**
 * REST controller for transaction lookup operations.
 *
 * CONTRACT:
 * - GET /transactions/{referenceId} → 200 OK | 404 Not Found
 *
 * RULES:
 * - Lookups are scoped to the caller's account; another user's key is reported as not found
 * - Pure delegation to LedgerService
 */
@RestController
@RequestMapping("/transactions")
@Tag(name = "Transactions", description = "Lookup transactions by referenceId")
public class TransactionController {

    private final LedgerService ledgerService;

    public TransactionController(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * Find the caller's ledger entry by its referenceId.
     *
     * HTTP Contract:
     * - 200 OK         → entry found
     * - 404 Not Found  → no entry with this referenceId on the caller's account
     */
    @GetMapping("/{referenceId}")
    @Operation(
        summary = "Find transaction by referenceId",
        description = "Retrieves one of the caller's ledger entries by its referenceId. " +
                      "Use this to verify idempotent operation results."
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Transaction found"),
        @ApiResponse(responseCode = "404", description = "Transaction not found for given referenceId")
    })
    public ResponseEntity<ApiResponses.TransactionResponse> findByReferenceId(
            @Parameter(description = "referenceId supplied when the transaction was proposed")
            @PathVariable String referenceId,
            Authentication authentication) {

        return ledgerService.findByReference(authentication.getName(), referenceId)
                .map(entry -> ResponseEntity.ok(new ApiResponses.TransactionResponse(entry)))
                .orElseThrow(() -> new NoSuchElementException(
                        "Transaction not found for referenceId: " + referenceId
                ));
    }
}
