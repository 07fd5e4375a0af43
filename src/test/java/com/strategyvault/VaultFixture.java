package com.strategyvault;

import com.strategyvault.asset.InMemoryAssetLedger;
import com.strategyvault.config.VaultConfig;
import com.strategyvault.event.VaultEvent;
import com.strategyvault.service.MultiStrategyVault;
import com.strategyvault.service.OperationGuard;
import com.strategyvault.service.Rebalancer;
import com.strategyvault.service.ShareLedger;
import com.strategyvault.service.UndoJournal;
import com.strategyvault.service.ValuationOracle;
import com.strategyvault.service.ValuationTracker;
import com.strategyvault.service.VaultPauseState;
import com.strategyvault.service.WithdrawalQueue;
import com.strategyvault.simulation.SimulatedConvertibleStrategy;
import com.strategyvault.simulation.SimulatedLockedStrategy;
import com.strategyvault.strategy.ConvertibleStrategy;
import com.strategyvault.strategy.StrategyGateway;
import com.strategyvault.strategy.StrategyRegistry;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the vault components by hand, the way the Spring context does, around an
 * in-memory USDC ledger with 6 decimals. Published events are collected in {@link #events}.
 */
public class VaultFixture {

    public static final String VAULT = "vault";

    public final List<Object> events = new ArrayList<>();
    public final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    public final VaultConfig config = new VaultConfig();
    public final UndoJournal journal = new UndoJournal();
    public final OperationGuard guard = new OperationGuard(journal, events::add);
    public final InMemoryAssetLedger usdc = new InMemoryAssetLedger("USDC", 6, journal);
    public final StrategyGateway gateway = new StrategyGateway();
    public final StrategyRegistry registry = new StrategyRegistry(config, gateway, journal, guard, clock);
    public final ShareLedger shares = new ShareLedger(journal);
    public final ValuationOracle oracle = new ValuationOracle(config, usdc, registry, gateway);
    public final ValuationTracker tracker = new ValuationTracker(oracle, journal, guard, clock);
    public final WithdrawalQueue queue = new WithdrawalQueue(config, usdc, journal, guard, clock);
    public final Rebalancer rebalancer = new Rebalancer(config, usdc, oracle, registry, gateway, queue, guard, clock);
    public final VaultPauseState pauseState = new VaultPauseState(journal, guard, clock);
    public final MultiStrategyVault vault = new MultiStrategyVault(config, usdc, shares, registry, oracle, tracker,
            rebalancer, queue, pauseState, guard, clock);

    /**
     * Whole tokens to base units.
     */
    public static BigInteger units(long whole) {
        return BigInteger.valueOf(whole).multiply(BigInteger.TEN.pow(6));
    }

    /**
     * Mint {@code whole} tokens to {@code account} and approve the vault for all of it.
     */
    public void fund(String account, long whole) {
        usdc.mint(account, units(whole));
        usdc.approve(account, VAULT, usdc.balanceOf(account));
    }

    public SimulatedConvertibleStrategy deploy(String address) {
        SimulatedConvertibleStrategy strategy = new SimulatedConvertibleStrategy(address, address, usdc, journal);
        gateway.register(strategy);
        return strategy;
    }

    public SimulatedLockedStrategy deployLockable(String address) {
        SimulatedLockedStrategy strategy = new SimulatedLockedStrategy(address, address, usdc, journal, false);
        gateway.register(strategy);
        return strategy;
    }

    public void register(ConvertibleStrategy strategy) {
        gateway.register(strategy);
    }

    public <T extends VaultEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
