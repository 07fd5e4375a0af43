package com.strategyvault.config;

import com.strategyvault.model.StrategyKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Vault Configuration
 * Pool identity, asset, allocation caps, operator roles and startup strategies
 */
@Configuration
@ConfigurationProperties(prefix = "vault")
@Data
public class VaultConfig {

    // Account the vault holds its idle balance under
    private String address = "vault";

    private String name = "Multi Strategy Vault";
    private String shareSymbol = "MSV";

    // Underlying asset
    private String assetSymbol = "USDC";
    private int assetDecimals = 6;

    // Per-strategy allocation cap, 6000 = 60%
    private int maxAllocationBps = 6000;

    private AccessConfig access = new AccessConfig();

    private BootstrapConfig bootstrap = new BootstrapConfig();

    private SimulationConfig simulation = new SimulationConfig();

    @Data
    public static class AccessConfig {
        /**
         * User ids allowed to add/update/remove strategies and rebalance
         */
        private Set<String> managers = new LinkedHashSet<>(Set.of("manager"));

        /**
         * User ids allowed to pause, unpause and run the emergency unwind. Admins are also managers.
         */
        private Set<String> admins = new LinkedHashSet<>(Set.of("admin"));
    }

    @Data
    public static class BootstrapConfig {
        /**
         * Register the strategies below on startup
         */
        private boolean enabled = true;

        private List<StrategySeed> strategies = new ArrayList<>();
    }

    @Data
    public static class StrategySeed {
        private String address;
        private String name;
        private StrategyKind kind = StrategyKind.CONVERTIBLE;
        private int allocationBps;
        private boolean hasLockup;

        /**
         * Deploy a simulated endpoint for this address before registering it
         */
        private boolean simulated = true;
    }

    @Data
    public static class SimulationConfig {
        /**
         * Expose /api/simulation (faucet, yield, lockups). Disable outside of test environments.
         */
        private boolean enabled = true;

        /**
         * Upper bound for one faucet mint, in whole tokens
         */
        private long faucetLimit = 1_000_000;
    }
}
