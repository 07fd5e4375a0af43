package com.strategyvault.controller;

import com.strategyvault.config.VaultConfig;
import com.strategyvault.service.MultiStrategyVault;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Health", description = "Application health check endpoints")
@RequiredArgsConstructor
public class HealthController {

    private final VaultConfig vaultConfig;
    private final MultiStrategyVault vault;

    @GetMapping("/health")
    @Operation(summary = "Get application health status")
    public Map<String, Object> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("timestamp", Instant.now());
        health.put("application", vaultConfig.getName());
        health.put("asset", vaultConfig.getAssetSymbol());
        health.put("paused", vault.isPaused());
        health.put("strategies", vault.listStrategies().size());
        return health;
    }
}
