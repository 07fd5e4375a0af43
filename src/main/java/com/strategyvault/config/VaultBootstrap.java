package com.strategyvault.config;

import com.strategyvault.model.StrategyKind;
import com.strategyvault.service.MultiStrategyVault;
import com.strategyvault.simulation.SimulationService;
import com.strategyvault.strategy.StrategyGateway;
import com.strategyvault.util.CurrentUserContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Registers the strategies listed under {@code vault.bootstrap.strategies} once the
 * application is ready, deploying simulated endpoints where requested.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultBootstrap {

    private static final String BOOTSTRAP_ACTOR = "bootstrap";

    private final VaultConfig vaultConfig;
    private final MultiStrategyVault vault;
    private final SimulationService simulationService;
    private final StrategyGateway gateway;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        VaultConfig.BootstrapConfig bootstrap = vaultConfig.getBootstrap();
        if (!bootstrap.isEnabled() || bootstrap.getStrategies().isEmpty()) {
            log.info("Vault bootstrap disabled or empty, starting with no strategies");
            return;
        }
        CurrentUserContext.callWithUserContext(BOOTSTRAP_ACTOR, () -> {
            bootstrap.getStrategies().forEach(this::seed);
            return null;
        });
        log.info("Vault bootstrap completed: {} strategies registered", vault.listStrategies().size());
    }

    private void seed(VaultConfig.StrategySeed seed) {
        try {
            if (seed.isSimulated() && seed.getKind() == StrategyKind.CONVERTIBLE && !gateway.isKnown(seed.getAddress())) {
                simulationService.deployStrategy(seed.getAddress(), seed.getName(), seed.isHasLockup());
            }
            int index = vault.addStrategy(seed.getAddress(), seed.getAllocationBps(), seed.getKind(), seed.isHasLockup());
            log.info("Bootstrap strategy #{} {} ({}) at {} bps", index, seed.getName(), seed.getAddress(), seed.getAllocationBps());
        } catch (RuntimeException e) {
            log.error("Failed to register bootstrap strategy {}: {}", seed.getAddress(), e.getMessage());
        }
    }
}
