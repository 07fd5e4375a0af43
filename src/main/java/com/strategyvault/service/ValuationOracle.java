package com.strategyvault.service;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.config.VaultConfig;
import com.strategyvault.model.StrategyAllocation;
import com.strategyvault.model.StrategyValuation;
import com.strategyvault.strategy.ConvertibleStrategy;
import com.strategyvault.strategy.StrategyCalls;
import com.strategyvault.strategy.StrategyGateway;
import com.strategyvault.strategy.StrategyRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Values the pool from live balances: idle assets plus what each active strategy
 * would return. Read-only; a failing or inconsistent strategy makes the whole
 * valuation unavailable.
 */
@Service
@RequiredArgsConstructor
public class ValuationOracle {

    private final VaultConfig config;
    private final AssetLedger assetLedger;
    private final StrategyRegistry registry;
    private final StrategyGateway gateway;

    public BigInteger totalValue() {
        BigInteger total = idleBalance();
        for (StrategyAllocation strategy : registry.activeStrategies()) {
            total = total.add(value(strategy).value());
        }
        return total;
    }

    public BigInteger idleBalance() {
        return assetLedger.balanceOf(config.getAddress());
    }

    /**
     * Valuation of every active strategy, in registry order.
     */
    public List<StrategyValuation> activeValuations() {
        return registry.activeStrategies().stream().map(this::value).toList();
    }

    public StrategyValuation value(StrategyAllocation strategy) {
        if (strategy.isConvertible()) {
            ConvertibleStrategy endpoint = gateway.resolve(strategy.getAddress());
            BigInteger units = StrategyCalls.invoke(strategy, "balanceOf", () -> endpoint.balanceOf(config.getAddress()));
            BigInteger assets = units.signum() == 0
                    ? BigInteger.ZERO
                    : StrategyCalls.invoke(strategy, "convertToAssets", () -> endpoint.convertToAssets(units));
            return new StrategyValuation(strategy, units, assets);
        }
        BigInteger held = assetLedger.balanceOf(strategy.getAddress());
        return new StrategyValuation(strategy, held, held);
    }
}
