package com.tokenledger.controller;

import com.tokenledger.dto.AmountRequest;
import com.tokenledger.dto.ApiResponses;
import com.tokenledger.dto.RewardGrantRequest;
import com.tokenledger.service.EarningActivity;
import com.tokenledger.service.RewardService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.Map;

/**
 * REST controller for rewards and staking.
 *
 * HTTP CONTRACT SUMMARY:
 * POST   /accounts/me/rewards/daily          → 200 | 409 ALREADY_CLAIMED_TODAY
 * POST   /accounts/me/rewards/{activity}     → 200 | 400 unknown activity
 * GET    /rewards/catalog                    → 200
 * POST   /accounts/me/stakes                 → 200 | 400 | 409
 * POST   /accounts/me/stakes/release         → 200 | 400 | 409
 */
@RestController
@Tag(name = "Rewards & Staking", description = "Daily rewards, earning activities and token staking")
public class RewardController {

    private final RewardService rewardService;

    public RewardController(RewardService rewardService) {
        this.rewardService = rewardService;
    }

    @PostMapping("/accounts/me/rewards/daily")
    @Operation(summary = "Claim daily reward", description = "Credits the daily login reward once per reward window")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Reward credited"),
        @ApiResponse(responseCode = "409", description = "Already claimed in the current window")
    })
    public ResponseEntity<ApiResponses.TransactionResultResponse> claimDailyReward(Authentication authentication) {
        return OutcomeResponses.toResponse(rewardService.claimDailyReward(authentication.getName()));
    }

    /**
     * Credit a catalogued earning activity. A repeated referenceId is replayed, not credited twice.
     */
    @PostMapping("/accounts/me/rewards/{activity}")
    @Operation(
        summary = "Grant activity reward",
        description = "Credits referral, content_completion, lending or loan_repayment. " +
                      "Amount defaults to the catalogue value."
    )
    public ResponseEntity<ApiResponses.TransactionResultResponse> grantReward(
            @Parameter(description = "Earning activity, e.g. referral") @PathVariable String activity,
            @Valid @RequestBody(required = false) RewardGrantRequest request,
            Authentication authentication) {

        EarningActivity earningActivity = EarningActivity.fromSource(activity);
        BigDecimal amount = request != null ? request.getAmount() : null;
        String referenceId = request != null ? request.getReferenceId() : null;

        return OutcomeResponses.toResponse(
                rewardService.grantReward(authentication.getName(), earningActivity, amount, referenceId));
    }

    @GetMapping("/rewards/catalog")
    @Operation(summary = "Earning catalogue", description = "Default token amount per earning activity")
    public ResponseEntity<Map<String, BigDecimal>> earningCatalog() {
        return ResponseEntity.ok(rewardService.earningCatalog());
    }

    @PostMapping("/accounts/me/stakes")
    @Operation(summary = "Stake tokens", description = "Moves tokens from the balance into the staked amount")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Tokens staked"),
        @ApiResponse(responseCode = "400", description = "Invalid amount"),
        @ApiResponse(responseCode = "409", description = "Insufficient balance or below minimum stake")
    })
    public ResponseEntity<ApiResponses.TransactionResultResponse> stake(
            @Valid @RequestBody AmountRequest request,
            Authentication authentication) {
        return OutcomeResponses.toResponse(rewardService.stake(authentication.getName(), request.getAmount()));
    }

    @PostMapping("/accounts/me/stakes/release")
    @Operation(summary = "Unstake tokens", description = "Returns staked tokens to the balance")
    @io.swagger.v3.oas.annotations.responses.ApiResponses({
        @ApiResponse(responseCode = "200", description = "Tokens released"),
        @ApiResponse(responseCode = "400", description = "Invalid amount"),
        @ApiResponse(responseCode = "409", description = "Amount exceeds the staked amount")
    })
    public ResponseEntity<ApiResponses.TransactionResultResponse> unstake(
            @Valid @RequestBody AmountRequest request,
            Authentication authentication) {
        return OutcomeResponses.toResponse(rewardService.unstake(authentication.getName(), request.getAmount()));
    }
}
