package com.strategyvault.controller;

import com.strategyvault.dto.ApiResponse;
import com.strategyvault.dto.DeployStrategyRequest;
import com.strategyvault.dto.FaucetRequest;
import com.strategyvault.simulation.SimulatedConvertibleStrategy;
import com.strategyvault.simulation.SimulatedLockedStrategy;
import com.strategyvault.simulation.SimulationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Test-environment controls over the in-process asset and simulated strategies.
 */
@RestController
@RequestMapping("/api/simulation")
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "vault.simulation.enabled", havingValue = "true", matchIfMissing = true)
@Tag(name = "Simulation", description = "In-process asset faucet and simulated strategies")
public class SimulationController {

    private final SimulationService simulationService;

    @PostMapping("/faucet")
    @Operation(summary = "Mint test assets", description = "Mint whole tokens of the asset to an account")
    public ResponseEntity<ApiResponse<Map<String, Object>>> faucet(@Valid @RequestBody FaucetRequest request) {
        BigInteger minted = simulationService.faucet(request.getAccount(), request.getAmount());
        return ResponseEntity.ok(ApiResponse.success("Assets minted",
                Map.of("account", request.getAccount(), "minted", minted)));
    }

    @PostMapping("/approve")
    @Operation(summary = "Approve the vault", description = "Let the vault pull up to amount base units from owner")
    public ResponseEntity<ApiResponse<Map<String, Object>>> approve(@RequestParam("owner") String owner,
                                                                    @RequestParam("amount") BigInteger amount) {
        simulationService.approveVault(owner, amount);
        return ResponseEntity.ok(ApiResponse.success("Vault approved", Map.of("owner", owner, "amount", amount)));
    }

    @PostMapping("/strategies")
    @Operation(summary = "Deploy a simulated convertible strategy",
               description = "Makes the address resolvable so it can be added to the vault")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deployStrategy(@Valid @RequestBody DeployStrategyRequest request) {
        SimulatedConvertibleStrategy strategy = simulationService.deployStrategy(
                request.getAddress(), request.getName(), request.isLockable());
        return ResponseEntity.ok(ApiResponse.success("Strategy deployed", describe(strategy)));
    }

    @GetMapping("/strategies")
    @Operation(summary = "List simulated strategies")
    public ResponseEntity<ApiResponse<List<Map<String, Object>>>> listStrategies() {
        List<Map<String, Object>> strategies = simulationService.deployedStrategies().values().stream()
                .map(this::describe)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(strategies));
    }

    @PostMapping("/strategies/{address}/yield")
    @Operation(summary = "Simulate yield", description = "Grow the strategy's assets by bps basis points")
    public ResponseEntity<ApiResponse<Map<String, Object>>> simulateYield(@PathVariable String address,
                                                                          @RequestParam("bps") int bps) {
        BigInteger gain = simulationService.simulateYield(address, bps);
        return ResponseEntity.ok(ApiResponse.success("Yield simulated", Map.of("address", address, "gain", gain)));
    }

    @PostMapping("/strategies/{address}/loss")
    @Operation(summary = "Simulate loss", description = "Shrink the strategy's assets by bps basis points")
    public ResponseEntity<ApiResponse<Map<String, Object>>> simulateLoss(@PathVariable String address,
                                                                         @RequestParam("bps") int bps) {
        BigInteger loss = simulationService.simulateLoss(address, bps);
        return ResponseEntity.ok(ApiResponse.success("Loss simulated", Map.of("address", address, "loss", loss)));
    }

    @PostMapping("/strategies/{address}/lock")
    @Operation(summary = "Lock redemptions of a lockable strategy")
    public ResponseEntity<ApiResponse<Map<String, Object>>> lock(@PathVariable String address) {
        simulationService.lock(address);
        return ResponseEntity.ok(ApiResponse.success("Strategy locked", Map.of("address", address, "locked", true)));
    }

    @PostMapping("/strategies/{address}/unlock")
    @Operation(summary = "Unlock redemptions of a lockable strategy")
    public ResponseEntity<ApiResponse<Map<String, Object>>> unlock(@PathVariable String address) {
        simulationService.unlock(address);
        return ResponseEntity.ok(ApiResponse.success("Strategy unlocked", Map.of("address", address, "locked", false)));
    }

    @GetMapping("/balances/{account}")
    @Operation(summary = "Balances of an account", description = "Asset balance, vault allowance, shares and share value")
    public ResponseEntity<ApiResponse<Map<String, Object>>> balances(@PathVariable String account) {
        return ResponseEntity.ok(ApiResponse.success(simulationService.balances(account)));
    }

    private Map<String, Object> describe(SimulatedConvertibleStrategy strategy) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("address", strategy.address());
        view.put("name", strategy.name());
        view.put("totalAssets", strategy.totalAssets());
        view.put("totalUnits", strategy.totalUnits());
        view.put("lockable", strategy instanceof SimulatedLockedStrategy);
        if (strategy instanceof SimulatedLockedStrategy locked) {
            view.put("locked", locked.isLocked());
        }
        return view;
    }
}
