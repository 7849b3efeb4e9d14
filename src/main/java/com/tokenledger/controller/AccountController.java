package com.tokenledger.controller;

import com.tokenledger.domain.TokenAccount;
import com.tokenledger.dto.ApiResponses;
import com.tokenledger.dto.ProposeTransactionRequest;
import com.tokenledger.service.AccountService;
import com.tokenledger.service.LedgerService;
import com.tokenledger.service.TransactionOutcome;
import com.tokenledger.service.TransactionProcessor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the caller's own token account.
 *
 * RESPONSIBILITIES:
 * - Show the account (created with the starting grant on first access)
 * - Propose transactions and list recent ledger entries
 * - Reconcile stored totals against the ledger
 *
 * RULES:
 * - The account is always the authenticated caller's: the user id is the token subject
 * - No business logic: pure delegation to AccountService, TransactionProcessor and LedgerService
 * - Rejections become TransactionRejectedException (400 / 409 via GlobalExceptionHandler)
 *
 * HTTP CONTRACT SUMMARY:
 * GET    /accounts/me                    → 200
 * POST   /accounts/me/transactions       → 200 | 400 | 409
 * GET    /accounts/me/transactions       → 200 (empty list if none) | 400 bad limit
 * GET    /accounts/me/reconciliation     → 200 | 404
 */
@RestController
@RequestMapping("/accounts/me")
@Tag(name = "Account & Transactions", description = "Token balance, ledger and transaction proposals")
public class AccountController {

    private final AccountService accountService;
    private final TransactionProcessor transactionProcessor;
    private final LedgerService ledgerService;

    public AccountController(AccountService accountService,
                             TransactionProcessor transactionProcessor,
                             LedgerService ledgerService) {
        this.accountService = accountService;
        this.transactionProcessor = transactionProcessor;
        this.ledgerService = ledgerService;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // READ
    // ─────────────────────────────────────────────────────────────────────────

    @GetMapping
    @Operation(
        summary = "Get my account",
        description = "Balance and lifetime totals. The account is created with the starting grant on first access."
    )
    public ResponseEntity<ApiResponses.AccountResponse> getAccount(Authentication authentication) {
        TokenAccount account = accountService.getAccount(authentication.getName());
        return ResponseEntity.ok(new ApiResponses.AccountResponse(account));
    }

    /**
     * Recent ledger entries, newest first.
     *
     * HTTP Contract:
     * - 200 OK          → up to {@code limit} entries (capped at the configured maximum)
     * - 400 Bad Request → limit &lt; 1
     */
    @GetMapping("/transactions")
    @Operation(
        summary = "Get recent transactions",
        description = "Most recent ledger entries, newest first. Entries with equal timestamps keep insertion order."
    )
    public ResponseEntity<List<ApiResponses.TransactionResponse>> getRecentTransactions(
            @Parameter(description = "Maximum number of entries (default 20, max 100)")
            @RequestParam(required = false) Integer limit,
            Authentication authentication) {

        String userId = authentication.getName();
        List<ApiResponses.TransactionResponse> responses =
                (limit == null ? ledgerService.recent(userId) : ledgerService.recent(userId, limit))
                .stream()
                .map(ApiResponses.TransactionResponse::new)
                .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/reconciliation")
    @Operation(
        summary = "Reconcile account",
        description = "Replays the ledger from the starting grant and compares the result with the stored totals"
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Report produced"),
        @ApiResponse(responseCode = "404", description = "Account has not been created yet")
    })
    public ResponseEntity<ApiResponses.ReconciliationResponse> reconcile(Authentication authentication) {
        return ResponseEntity.ok(new ApiResponses.ReconciliationResponse(
                ledgerService.reconcile(authentication.getName())));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // MUTATIONS
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Propose a transaction against the caller's account.
     *
     * IDEMPOTENCY: a repeated referenceId returns the original entry with
     * {@code replayed = true} and changes nothing.
     *
     * HTTP Contract:
     * - 200 OK          → accepted (or replayed)
     * - 400 Bad Request → INVALID_AMOUNT, unknown type, blank source
     * - 409 Conflict    → INSUFFICIENT_BALANCE, BELOW_MINIMUM_STAKE,
     *                     EXCEEDS_STAKED_AMOUNT, ALREADY_CLAIMED_TODAY
     */
    @PostMapping("/transactions")
    @Operation(
        summary = "Propose transaction",
        description = "Earn, spend, stake or unstake tokens. Rejections carry a stable reason code."
    )
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Transaction accepted or replayed"),
        @ApiResponse(responseCode = "400", description = "Invalid amount or malformed request"),
        @ApiResponse(responseCode = "409", description = "Rejected by a ledger rule")
    })
    public ResponseEntity<ApiResponses.TransactionResultResponse> propose(
            @Valid @RequestBody ProposeTransactionRequest request,
            Authentication authentication) {

        TransactionOutcome outcome = transactionProcessor.propose(
                authentication.getName(),
                request.getType(),
                request.getAmount(),
                request.getSource(),
                request.getDescription(),
                request.getReferenceId()
        );

        return OutcomeResponses.toResponse(outcome);
    }
}
