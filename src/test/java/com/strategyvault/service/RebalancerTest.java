package com.strategyvault.service;

import com.strategyvault.VaultFixture;
import com.strategyvault.asset.InMemoryAssetLedger;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.RebalanceLeg;
import com.strategyvault.model.RebalanceMovement;
import com.strategyvault.model.RebalanceMovement.Direction;
import com.strategyvault.model.RebalancePlan;
import com.strategyvault.model.RebalanceReport;
import com.strategyvault.model.StrategyKind;
import com.strategyvault.simulation.SimulatedConvertibleStrategy;
import com.strategyvault.strategy.ConvertibleStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.strategyvault.VaultFixture.VAULT;
import static com.strategyvault.VaultFixture.units;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RebalancerTest {

    private VaultFixture fx;
    private SimulatedConvertibleStrategy strategyA;
    private SimulatedConvertibleStrategy strategyB;

    @BeforeEach
    void setUp() {
        fx = new VaultFixture();
        strategyA = fx.deploy("strategy-a");
        strategyB = fx.deploy("strategy-b");
    }

    private RebalanceReport rebalance() {
        return fx.guard.execute("rebalance", () -> fx.rebalancer.rebalance());
    }

    @Test
    void planOnIdleOnlyPoolInvestsInRegistryOrder() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.registry.addStrategy("strategy-b", 3000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));

        RebalancePlan plan = fx.rebalancer.plan();

        assertTrue(plan.divestments().isEmpty());
        assertEquals(2, plan.investments().size());
        RebalanceLeg first = plan.investments().get(0);
        assertEquals("strategy-a", first.address());
        assertEquals(units(600), first.targetValue());
        assertEquals(units(600), first.amount());
        assertEquals(units(300), plan.investments().get(1).amount());
        // Unallocated 10% stays idle
        assertEquals(units(1000), plan.investable());
    }

    @Test
    void planDoesNotMoveAnything() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));

        fx.rebalancer.plan();

        assertEquals(units(1000), fx.usdc.balanceOf(VAULT));
        assertEquals(BigInteger.ZERO, strategyA.totalAssets());
    }

    @Test
    void balancedPoolProducesEmptyPlan() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));
        rebalance();

        assertTrue(fx.rebalancer.plan().isEmpty());
        RebalanceReport again = rebalance();
        assertTrue(again.movements().isEmpty());
    }

    @Test
    void divestsBeforeInvesting() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));
        rebalance();

        fx.registry.updateAllocation(0, 2000);
        fx.registry.updateAllocation(1, 6000);
        RebalanceReport report = rebalance();

        assertEquals(Direction.DIVEST, report.movements().get(0).direction());
        assertEquals(Direction.INVEST, report.movements().get(1).direction());
        assertEquals(units(400), report.divested());
        assertEquals(units(200), report.invested());
        assertEquals(units(200), strategyA.totalAssets());
        assertEquals(units(600), strategyB.totalAssets());
        assertEquals(units(200), report.idleAfter());
    }

    @Test
    void divestRedeemsEnoughUnitsToCoverTheExcess() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));
        rebalance();
        strategyA.simulateYield(1000);
        // Claim of 500 against 1060: target for A is 60% of 560
        fx.queue.enqueue("alice", units(1), units(500));

        RebalanceReport report = rebalance();

        RebalanceMovement divest = report.movements().get(0);
        assertEquals(Direction.DIVEST, divest.direction());
        // floor(324 * 600 / 660) = 294.545454, plus one unit
        assertEquals(BigInteger.valueOf(294_545_455), divest.units());
        assertTrue(divest.assets().compareTo(units(324)) >= 0);
        assertTrue(fx.usdc.balanceOf(VAULT).compareTo(units(500)) >= 0);
    }

    @Test
    void queuedClaimsAreReservedFromInvestment() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));
        fx.queue.enqueue("alice", units(1), units(500));

        RebalancePlan plan = fx.rebalancer.plan();
        assertEquals(units(500), plan.investable());
        assertEquals(units(300), plan.investments().get(0).amount());

        rebalance();
        assertEquals(units(700), fx.usdc.balanceOf(VAULT));
    }

    @Test
    void shrinkingTargetDivestsAndKeepsClaimsIdle() {
        fx.registry.addStrategy("strategy-a", 5000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(100));
        rebalance();
        // A holds 50, idle 50; a claim of 40 leaves 10 unreserved
        fx.queue.enqueue("alice", units(1), units(40));
        fx.registry.updateAllocation(0, 6000);

        RebalanceReport report = rebalance();

        // Target 60% of 60 is 36, A already holds 50: divest 14
        assertEquals(units(14), report.divested());
        assertEquals(BigInteger.ZERO, report.invested());
        assertEquals(units(64), fx.usdc.balanceOf(VAULT));
    }

    @Test
    void directStrategyIsFundedByTransfer() {
        fx.registry.addStrategy("treasury", 2500, StrategyKind.DIRECT, false);
        fx.usdc.mint(VAULT, units(400));

        RebalanceReport report = rebalance();

        assertEquals(units(100), fx.usdc.balanceOf("treasury"));
        assertEquals(units(100), report.movements().get(0).units());
        assertEquals(units(400), fx.oracle.totalValue());
    }

    @Test
    void strategyPullingWrongAmountIsRejected() {
        ConvertibleStrategy greedy = mock(ConvertibleStrategy.class);
        when(greedy.address()).thenReturn("greedy");
        when(greedy.balanceOf(anyString())).thenReturn(BigInteger.ZERO);
        when(greedy.deposit(anyString(), any())).thenAnswer(invocation -> {
            BigInteger asked = invocation.getArgument(1);
            fx.usdc.transferFrom("greedy", VAULT, "greedy", asked.subtract(BigInteger.ONE));
            return asked;
        });
        fx.register(greedy);
        fx.registry.addStrategy("greedy", 5000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(100));

        VaultException ex = assertThrows(VaultException.class, this::rebalance);

        assertEquals(ErrorCode.STRATEGY_INCONSISTENT, ex.getErrorCode());
        assertEquals(units(100), fx.usdc.balanceOf(VAULT));
        assertEquals(BigInteger.ZERO, fx.usdc.allowance(VAULT, "greedy"));
    }

    @Test
    void strategyReportingMoreThanItPaidIsRejected() {
        ConvertibleStrategy liar = mock(ConvertibleStrategy.class);
        when(liar.address()).thenReturn("liar");
        when(liar.balanceOf(anyString())).thenReturn(units(10));
        when(liar.convertToAssets(any())).thenReturn(units(10));
        when(liar.convertToShares(any())).thenReturn(units(10));
        when(liar.redeem(anyString(), any())).thenReturn(units(10));
        fx.register(liar);
        fx.registry.addStrategy("liar", 0, StrategyKind.CONVERTIBLE, false);

        VaultException ex = assertThrows(VaultException.class, this::rebalance);

        assertEquals(ErrorCode.STRATEGY_INCONSISTENT, ex.getErrorCode());
        verify(liar).redeem(VAULT, units(10));
    }

    @Test
    void failingValuationAbortsPlanning() {
        ConvertibleStrategy broken = mock(ConvertibleStrategy.class);
        when(broken.address()).thenReturn("broken");
        when(broken.balanceOf(anyString())).thenThrow(new IllegalStateException("offline"));
        fx.register(broken);
        fx.registry.addStrategy("broken", 1000, StrategyKind.CONVERTIBLE, false);

        VaultException ex = assertThrows(VaultException.class, () -> fx.rebalancer.plan());

        assertEquals(ErrorCode.STRATEGY_CALL_FAILED, ex.getErrorCode());
        verify(broken, never()).deposit(anyString(), any());
    }

    @Test
    void refusedAllowanceResetAbortsInvestment() {
        InMemoryAssetLedger ledger = spy(fx.usdc);
        doReturn(false).when(ledger).approve(VAULT, "strategy-a", BigInteger.ZERO);
        Rebalancer rebalancer = new Rebalancer(fx.config, ledger, fx.oracle, fx.registry, fx.gateway, fx.queue,
                fx.guard, fx.clock);
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));

        VaultException ex = assertThrows(VaultException.class,
                () -> fx.guard.execute("rebalance", rebalancer::rebalance));

        assertEquals(ErrorCode.ASSET_TRANSFER_FAILED, ex.getErrorCode());
        assertEquals(units(1000), fx.usdc.balanceOf(VAULT));
        assertEquals(BigInteger.ZERO, strategyA.totalAssets());
    }

    @Test
    void inactiveStrategiesAreIgnored() {
        fx.registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        fx.registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(1000));
        rebalance();
        fx.registry.removeStrategy(1);

        RebalancePlan plan = fx.rebalancer.plan();

        assertEquals(units(600), plan.totalValue());
        assertEquals(1, plan.divestments().size());
        assertEquals("strategy-a", plan.divestments().get(0).address());
        assertTrue(plan.investments().isEmpty());
        assertEquals(units(400), strategyB.totalAssets());
    }
}
