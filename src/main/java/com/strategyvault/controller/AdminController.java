package com.strategyvault.controller;

import com.strategyvault.dto.ApiResponse;
import com.strategyvault.model.EmergencyUnwindReport;
import com.strategyvault.service.MultiStrategyVault;
import com.strategyvault.service.VaultAccessPolicy;
import com.strategyvault.util.ApiConstants;
import com.strategyvault.util.CurrentUserContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Admin-only circuit breaker and emergency controls.
 */
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin", description = "Pause switch and emergency unwind")
public class AdminController {

    private final MultiStrategyVault vault;
    private final VaultAccessPolicy accessPolicy;

    @PostMapping("/pause")
    @Operation(summary = "Pause the vault", description = "Rejects deposits, withdrawals and rebalances until unpaused")
    public ResponseEntity<ApiResponse<Map<String, Object>>> pause() {
        String admin = requireAdmin("pause the vault");
        log.info(ApiConstants.LOG_PAUSE_REQUEST, admin);
        vault.pause(admin);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_VAULT_PAUSED, Map.of("paused", vault.isPaused())));
    }

    @PostMapping("/unpause")
    @Operation(summary = "Unpause the vault")
    public ResponseEntity<ApiResponse<Map<String, Object>>> unpause() {
        String admin = requireAdmin("unpause the vault");
        log.info(ApiConstants.LOG_UNPAUSE_REQUEST, admin);
        vault.unpause(admin);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_VAULT_UNPAUSED, Map.of("paused", vault.isPaused())));
    }

    @PostMapping("/emergency-withdraw")
    @Operation(summary = "Emergency withdraw all",
               description = "Only while paused. Redeems every convertible strategy position back to idle balance; "
                       + "direct strategies are reported as skipped")
    public ResponseEntity<ApiResponse<EmergencyUnwindReport>> emergencyWithdrawAll() {
        String admin = requireAdmin("run the emergency unwind");
        log.warn(ApiConstants.LOG_EMERGENCY_REQUEST, admin);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_EMERGENCY_UNWIND, vault.emergencyWithdrawAll()));
    }

    private String requireAdmin(String action) {
        String user = CurrentUserContext.getRequiredUserId();
        accessPolicy.requireAdmin(user, action);
        return user;
    }
}
