package com.strategyvault.service;

import com.strategyvault.VaultFixture;
import com.strategyvault.event.ValuationChangedEvent;
import com.strategyvault.model.StrategyKind;
import com.strategyvault.simulation.SimulatedConvertibleStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.strategyvault.VaultFixture.VAULT;
import static com.strategyvault.VaultFixture.units;
import static org.junit.jupiter.api.Assertions.*;

class ValuationTrackerTest {

    private VaultFixture fx;
    private ValuationTracker tracker;

    @BeforeEach
    void setUp() {
        fx = new VaultFixture();
        tracker = fx.tracker;
    }

    @Test
    void firstAccrualOnlyStoresSnapshot() {
        fx.usdc.mint(VAULT, units(100));

        assertEquals(units(100), tracker.accrue());

        assertEquals(units(100), tracker.cachedTotalValue());
        assertNotNull(tracker.cachedAt());
        assertTrue(fx.eventsOf(ValuationChangedEvent.class).isEmpty());
    }

    @Test
    void changeBetweenSnapshotsIsReported() {
        SimulatedConvertibleStrategy strategy = fx.deploy("strategy-a");
        fx.registry.addStrategy("strategy-a", 5000, StrategyKind.CONVERTIBLE, false);
        fx.usdc.mint(VAULT, units(100));
        fx.guard.execute("rebalance", () -> fx.rebalancer.rebalance());
        tracker.accrue();

        strategy.simulateYield(2000);
        tracker.accrue();
        strategy.simulateLoss(5000);
        tracker.accrue();

        List<ValuationChangedEvent> events = fx.eventsOf(ValuationChangedEvent.class);
        assertEquals(2, events.size());
        assertEquals(units(10), events.get(0).delta());
        assertEquals(units(-30), events.get(1).delta());
        assertEquals(units(80), tracker.cachedTotalValue());
    }

    @Test
    void recordedValueIsNotReported() {
        fx.usdc.mint(VAULT, units(100));
        tracker.accrue();

        fx.usdc.mint(VAULT, units(50));
        tracker.record(units(150));
        tracker.accrue();

        assertTrue(fx.eventsOf(ValuationChangedEvent.class).isEmpty());
    }

    @Test
    void snapshotIsRestoredWhenOperationFails() {
        fx.usdc.mint(VAULT, units(100));
        tracker.accrue();
        fx.usdc.mint(VAULT, units(20));

        assertThrows(IllegalStateException.class, () -> fx.guard.run("op", () -> {
            tracker.accrue();
            throw new IllegalStateException("abort");
        }));

        assertEquals(units(100), tracker.cachedTotalValue());
        assertTrue(fx.eventsOf(ValuationChangedEvent.class).isEmpty());
    }
}
