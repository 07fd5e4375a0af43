package com.strategyvault.controller;

import com.strategyvault.dto.AddStrategyRequest;
import com.strategyvault.dto.AllocationUpdateRequest;
import com.strategyvault.dto.ApiResponse;
import com.strategyvault.model.RebalanceMovement;
import com.strategyvault.model.RebalancePlan;
import com.strategyvault.model.RebalanceReport;
import com.strategyvault.model.StrategyAllocation;
import com.strategyvault.service.MultiStrategyVault;
import com.strategyvault.service.VaultAccessPolicy;
import com.strategyvault.util.ApiConstants;
import com.strategyvault.util.CurrentUserContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/strategies")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Strategies", description = "Strategy registry and rebalancing")
public class StrategyController {

    private final MultiStrategyVault vault;
    private final VaultAccessPolicy accessPolicy;

    @GetMapping
    @Operation(summary = "List strategies", description = "Every registered strategy in registry order, inactive ones included")
    public ResponseEntity<ApiResponse<List<StrategyAllocation>>> listStrategies() {
        return ResponseEntity.ok(ApiResponse.success(vault.listStrategies()));
    }

    @PostMapping
    @Operation(summary = "Add a strategy",
               description = "Manager only. Rejects allocations above the per-strategy cap or pushing the total above 10000 bps")
    public ResponseEntity<ApiResponse<StrategyAllocation>> addStrategy(@Valid @RequestBody AddStrategyRequest request) {
        String user = requireManager("add a strategy");
        log.info(ApiConstants.LOG_ADD_STRATEGY_REQUEST, request.getKind(), request.getAddress(), request.getAllocationBps(), user);
        boolean hasLockup = Boolean.TRUE.equals(request.getHasLockup());
        int index = vault.addStrategy(request.getAddress(), request.getAllocationBps(), request.getKind(), hasLockup);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_STRATEGY_ADDED, vault.listStrategies().get(index)));
    }

    @PutMapping("/{index}/allocation")
    @Operation(summary = "Update a strategy's target allocation", description = "Manager only")
    public ResponseEntity<ApiResponse<StrategyAllocation>> updateAllocation(@PathVariable int index,
                                                                            @Valid @RequestBody AllocationUpdateRequest request) {
        String user = requireManager("update an allocation");
        log.info(ApiConstants.LOG_UPDATE_ALLOCATION_REQUEST, index, request.getAllocationBps(), user);
        vault.updateAllocation(index, request.getAllocationBps());
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_ALLOCATION_UPDATED, vault.listStrategies().get(index)));
    }

    @DeleteMapping("/{index}")
    @Operation(summary = "Deactivate a strategy",
               description = "Manager only. Idempotent; funds stay in the strategy until unwound")
    public ResponseEntity<ApiResponse<Map<String, Object>>> removeStrategy(@PathVariable int index) {
        String user = requireManager("remove a strategy");
        log.info(ApiConstants.LOG_REMOVE_STRATEGY_REQUEST, index, user);
        boolean deactivated = vault.removeStrategy(index);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_STRATEGY_REMOVED,
                Map.of("index", index, "deactivated", deactivated)));
    }

    @PostMapping("/rebalance")
    @Operation(summary = "Rebalance", description = "Manager only. Divest excess, then fund shortfalls from idle balance")
    public ResponseEntity<ApiResponse<RebalanceReport>> rebalance() {
        String user = requireManager("rebalance");
        log.info(ApiConstants.LOG_REBALANCE_REQUEST, user);
        RebalanceReport report = vault.rebalance();
        log.info(ApiConstants.LOG_REBALANCE_RESPONSE, report.divested(), report.invested(), report.idleAfter());
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_REBALANCE_COMPLETED, report));
    }

    @GetMapping("/rebalance/preview")
    @Operation(summary = "Preview a rebalance", description = "The legs a rebalance would execute now; moves nothing")
    public ResponseEntity<ApiResponse<RebalancePlan>> previewRebalance() {
        return ResponseEntity.ok(ApiResponse.success(vault.previewRebalance()));
    }

    @PostMapping("/{index}/unwind")
    @Operation(summary = "Unwind a strategy",
               description = "Manager only. Redeem every unit held in a convertible strategy back to idle balance")
    public ResponseEntity<ApiResponse<RebalanceMovement>> unwindStrategy(@PathVariable int index) {
        String user = requireManager("unwind a strategy");
        log.info(ApiConstants.LOG_UNWIND_REQUEST, index, user);
        return ResponseEntity.ok(ApiResponse.success(ApiConstants.MSG_STRATEGY_UNWOUND, vault.unwindStrategy(index)));
    }

    private String requireManager(String action) {
        String user = CurrentUserContext.getRequiredUserId();
        accessPolicy.requireManager(user, action);
        return user;
    }
}
