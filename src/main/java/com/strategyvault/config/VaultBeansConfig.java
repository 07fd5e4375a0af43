package com.strategyvault.config;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.asset.InMemoryAssetLedger;
import com.strategyvault.service.UndoJournal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the asset ledger and the clock used for event timestamps.
 */
@Configuration
@Slf4j
public class VaultBeansConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AssetLedger assetLedger(VaultConfig vaultConfig, UndoJournal journal) {
        log.info("Asset ledger initialized: symbol={}, decimals={}", vaultConfig.getAssetSymbol(), vaultConfig.getAssetDecimals());
        return new InMemoryAssetLedger(vaultConfig.getAssetSymbol(), vaultConfig.getAssetDecimals(), journal);
    }
}
