package com.strategyvault.controller;

import com.strategyvault.dto.ApiResponse;
import com.strategyvault.dto.DepositRequest;
import com.strategyvault.dto.DepositResponse;
import com.strategyvault.dto.MintRequest;
import com.strategyvault.dto.RedeemRequest;
import com.strategyvault.dto.ShareApprovalRequest;
import com.strategyvault.dto.VaultEventResponse;
import com.strategyvault.dto.WithdrawRequest;
import com.strategyvault.model.VaultMetrics;
import com.strategyvault.model.WithdrawalOutcome;
import com.strategyvault.model.WithdrawalRequest;
import com.strategyvault.service.MultiStrategyVault;
import com.strategyvault.service.persistence.VaultEventPersistenceService;
import com.strategyvault.util.ApiConstants;
import com.strategyvault.util.CurrentUserContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/vault")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Vault", description = "Deposits, withdrawals, queue and share accounting")
public class VaultController {

    private final MultiStrategyVault vault;
    private final VaultEventPersistenceService eventService;

    @PostMapping("/deposit")
    @Operation(summary = "Deposit assets",
               description = "Pull assets from the caller (who must have approved the vault) and mint shares, rounded down")
    public ResponseEntity<ApiResponse<DepositResponse>> deposit(@Valid @RequestBody DepositRequest request) {
        String caller = CurrentUserContext.getRequiredUserId();
        String receiver = orCaller(request.getReceiver(), caller);
        log.info(ApiConstants.LOG_DEPOSIT_REQUEST, request.getAssets(), caller, receiver);
        BigInteger shares = vault.deposit(caller, request.getAssets(), receiver);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_DEPOSIT_SUCCESS,
                depositResponse(caller, receiver, request.getAssets(), shares)));
    }

    @PostMapping("/mint")
    @Operation(summary = "Mint exact shares", description = "Mint an exact share amount, charging assets rounded up")
    public ResponseEntity<ApiResponse<DepositResponse>> mint(@Valid @RequestBody MintRequest request) {
        String caller = CurrentUserContext.getRequiredUserId();
        String receiver = orCaller(request.getReceiver(), caller);
        log.info(ApiConstants.LOG_MINT_REQUEST, request.getShares(), caller, receiver);
        BigInteger assets = vault.mint(caller, request.getShares(), receiver);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_MINT_SUCCESS,
                depositResponse(caller, receiver, assets, request.getShares())));
    }

    @PostMapping("/withdraw")
    @Operation(summary = "Withdraw exact assets",
               description = "Burn shares (rounded up) and pay immediately, or queue the claim when idle liquidity is short")
    public ResponseEntity<ApiResponse<WithdrawalOutcome>> withdraw(@Valid @RequestBody WithdrawRequest request) {
        String caller = CurrentUserContext.getRequiredUserId();
        String receiver = orCaller(request.getReceiver(), caller);
        String owner = orCaller(request.getOwner(), caller);
        log.info(ApiConstants.LOG_WITHDRAW_REQUEST, request.getAssets(), caller, owner, receiver);
        WithdrawalOutcome outcome = vault.withdraw(caller, request.getAssets(), receiver, owner);
        return withdrawalResponse(outcome);
    }

    @PostMapping("/redeem")
    @Operation(summary = "Redeem exact shares",
               description = "Burn shares for assets (rounded down), paid immediately or queued")
    public ResponseEntity<ApiResponse<WithdrawalOutcome>> redeem(@Valid @RequestBody RedeemRequest request) {
        String caller = CurrentUserContext.getRequiredUserId();
        String receiver = orCaller(request.getReceiver(), caller);
        String owner = orCaller(request.getOwner(), caller);
        log.info(ApiConstants.LOG_REDEEM_REQUEST, request.getShares(), caller, owner, receiver);
        WithdrawalOutcome outcome = vault.redeem(caller, request.getShares(), receiver, owner);
        return withdrawalResponse(outcome);
    }

    @PostMapping("/shares/approve")
    @Operation(summary = "Approve a share spender",
               description = "Allow another account to withdraw or redeem on the caller's behalf")
    public ResponseEntity<ApiResponse<Map<String, Object>>> approveShares(@Valid @RequestBody ShareApprovalRequest request) {
        String owner = CurrentUserContext.getRequiredUserId();
        vault.approveShares(owner, request.getSpender(), request.getShares());
        Map<String, Object> body = Map.of(
            "owner", owner,
            "spender", request.getSpender(),
            "allowance", vault.shareAllowance(owner, request.getSpender())
        );
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_SHARES_APPROVED, body));
    }

    @GetMapping("/withdrawals")
    @Operation(summary = "List the caller's withdrawal requests", description = "All requests, completed ones included")
    public ResponseEntity<ApiResponse<List<WithdrawalRequest>>> pendingWithdrawals() {
        String holder = CurrentUserContext.getRequiredUserId();
        return ResponseEntity.ok(ApiResponse.success(vault.pendingWithdrawals(holder)));
    }

    @PostMapping("/withdrawals/{requestId}/complete")
    @Operation(summary = "Complete a queued withdrawal",
               description = "Pay a queued claim once idle balance covers it. "
                       + "An operator may settle on behalf of a holder via the holder parameter; assets always go to the holder.")
    public ResponseEntity<ApiResponse<Map<String, Object>>> completeWithdrawal(
            @PathVariable int requestId,
            @RequestParam(value = "holder", required = false) String holder) {
        String target = orCaller(holder, CurrentUserContext.getRequiredUserId());
        log.info(ApiConstants.LOG_COMPLETE_REQUEST, requestId, target);
        BigInteger paid = vault.completeWithdrawal(target, requestId);
        Map<String, Object> body = Map.of("holder", target, "requestId", requestId, "assetsPaid", paid);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_WITHDRAWAL_COMPLETED, body));
    }

    @GetMapping("/total-value")
    @Operation(summary = "Total pool value", description = "Idle balance plus the value of every active strategy")
    public ResponseEntity<ApiResponse<BigInteger>> totalValue() {
        return ResponseEntity.ok(ApiResponse.success(vault.totalValue()));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Vault metrics",
               description = "Total value, total shares, price per share, queued claims and valuation snapshot")
    public ResponseEntity<ApiResponse<VaultMetrics>> metrics() {
        log.debug(ApiConstants.LOG_GET_METRICS_REQUEST);
        return ResponseEntity.ok(ApiResponse.success(vault.metrics()));
    }

    @GetMapping("/balance")
    @Operation(summary = "Caller's share balance and its current value")
    public ResponseEntity<ApiResponse<Map<String, Object>>> balance() {
        String holder = CurrentUserContext.getRequiredUserId();
        BigInteger shares = vault.shareBalanceOf(holder);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("holder", holder);
        body.put("shares", shares);
        body.put("assets", shares.signum() == 0 ? BigInteger.ZERO : vault.convertToAssets(shares));
        return ResponseEntity.ok(ApiResponse.success(body));
    }

    @GetMapping("/preview")
    @Operation(summary = "Preview a conversion",
               description = "type is one of deposit, mint, withdraw, redeem; uses the same rounding as the operation")
    public ResponseEntity<ApiResponse<Map<String, Object>>> preview(@RequestParam("type") String type,
                                                                    @RequestParam("amount") BigInteger amount) {
        BigInteger result = switch (type.toLowerCase()) {
            case "deposit" -> vault.previewDeposit(amount);
            case "mint" -> vault.previewMint(amount);
            case "withdraw" -> vault.previewWithdraw(amount);
            case "redeem" -> vault.previewRedeem(amount);
            default -> throw new IllegalArgumentException("Unknown preview type: " + type);
        };
        return ResponseEntity.ok(ApiResponse.success(Map.of("type", type, "amount", amount, "result", result)));
    }

    @GetMapping("/events")
    @Operation(summary = "Recent vault events", description = "Latest 100 stored events, optionally for one holder")
    public ResponseEntity<ApiResponse<List<VaultEventResponse>>> events(
            @RequestParam(value = "holder", required = false) String holder) {
        return ResponseEntity.ok(ApiResponse.success(eventService.recentEvents(holder)));
    }

    private ResponseEntity<ApiResponse<WithdrawalOutcome>> withdrawalResponse(WithdrawalOutcome outcome) {
        log.info(ApiConstants.LOG_WITHDRAW_RESPONSE, outcome.settlement(), outcome.owner(), outcome.assets(), outcome.sharesBurned());
        String message = outcome.isQueued() ? ApiConstants.MSG_WITHDRAW_QUEUED : ApiConstants.MSG_WITHDRAW_SETTLED;
        return ResponseEntity.ok(ApiResponse.success(message, outcome));
    }

    private DepositResponse depositResponse(String caller, String receiver, BigInteger assets, BigInteger shares) {
        return DepositResponse.builder()
                .caller(caller)
                .receiver(receiver)
                .assets(assets)
                .shares(shares)
                .shareBalance(vault.shareBalanceOf(receiver))
                .build();
    }

    private static String orCaller(String value, String caller) {
        return value == null || value.isBlank() ? caller : value.trim();
    }
}
