package com.strategyvault.strategy;

import com.strategyvault.VaultFixture;
import com.strategyvault.event.StrategyAddedEvent;
import com.strategyvault.event.StrategyRemovedEvent;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.StrategyAllocation;
import com.strategyvault.model.StrategyKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyRegistryTest {

    private VaultFixture fx;
    private StrategyRegistry registry;

    @BeforeEach
    void setUp() {
        fx = new VaultFixture();
        registry = fx.registry;
        fx.deploy("strategy-a");
        fx.deploy("strategy-b");
        fx.deploy("strategy-c");
    }

    private static ErrorCode errorOf(Executable executable) {
        return assertThrows(VaultException.class, executable).getErrorCode();
    }

    @Test
    void addAssignsSequentialIndexes() {
        assertEquals(0, registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false));
        assertEquals(1, registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, true));

        List<StrategyAllocation> strategies = registry.strategies();
        assertEquals(2, strategies.size());
        assertTrue(strategies.get(1).isHasLockup());
        assertEquals(10_000, registry.totalActiveAllocationBps());
        assertEquals(2, fx.eventsOf(StrategyAddedEvent.class).size());
    }

    @Test
    @DisplayName("Per-strategy cap is 60% and the aggregate cap is 100%")
    void allocationCapsAreEnforced() {
        assertEquals(ErrorCode.ALLOCATION_EXCEEDS_MAX,
                errorOf(() -> registry.addStrategy("strategy-a", 6001, StrategyKind.CONVERTIBLE, false)));

        registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, false);

        assertEquals(ErrorCode.TOTAL_ALLOCATION_INVALID,
                errorOf(() -> registry.addStrategy("strategy-c", 1, StrategyKind.CONVERTIBLE, false)));
        assertEquals(2, registry.size());
    }

    @Test
    void zeroAllocationIsAllowedAtFullAggregate() {
        registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, false);

        assertEquals(2, registry.addStrategy("strategy-c", 0, StrategyKind.CONVERTIBLE, false));
    }

    @Test
    void invalidRegistrationsAreRejected() {
        assertEquals(ErrorCode.INVALID_ADDRESS, errorOf(() -> registry.addStrategy("", 100, StrategyKind.DIRECT, false)));
        assertEquals(ErrorCode.INVALID_ADDRESS,
                errorOf(() -> registry.addStrategy(VaultFixture.VAULT, 100, StrategyKind.DIRECT, false)));
        assertEquals(ErrorCode.UNSUPPORTED_STRATEGY_KIND, errorOf(() -> registry.addStrategy("strategy-a", 100, null, false)));
        assertEquals(ErrorCode.NEGATIVE_AMOUNT,
                errorOf(() -> registry.addStrategy("strategy-a", -1, StrategyKind.CONVERTIBLE, false)));
        assertEquals(ErrorCode.UNKNOWN_STRATEGY,
                errorOf(() -> registry.addStrategy("nowhere", 100, StrategyKind.CONVERTIBLE, false)));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("An address can be registered once, even after removal")
    void duplicateAddressIsRejectedActiveOrRemoved() {
        registry.addStrategy("strategy-a", 3000, StrategyKind.CONVERTIBLE, false);

        assertEquals(ErrorCode.DUPLICATE_STRATEGY,
                errorOf(() -> registry.addStrategy("strategy-a", 1000, StrategyKind.CONVERTIBLE, false)));

        registry.removeStrategy(0);
        assertTrue(registry.isRegistered("strategy-a"));
        assertEquals(ErrorCode.DUPLICATE_STRATEGY,
                errorOf(() -> registry.addStrategy("strategy-a", 1000, StrategyKind.CONVERTIBLE, false)));
        assertEquals(1, registry.size());
        assertTrue(registry.activeStrategies().isEmpty());
        assertFalse(registry.isRegistered("strategy-b"));
    }

    @Test
    void updateAllocationChecksCapsAgainstOtherStrategies() {
        registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        registry.addStrategy("strategy-b", 3000, StrategyKind.CONVERTIBLE, false);

        registry.updateAllocation(1, 4000);
        assertEquals(4000, registry.get(1).getAllocationBps());

        assertEquals(ErrorCode.TOTAL_ALLOCATION_INVALID, errorOf(() -> registry.updateAllocation(1, 4001)));
        assertEquals(ErrorCode.ALLOCATION_EXCEEDS_MAX, errorOf(() -> registry.updateAllocation(0, 7000)));
        assertEquals(ErrorCode.NEGATIVE_AMOUNT, errorOf(() -> registry.updateAllocation(0, -5)));
        assertEquals(ErrorCode.INVALID_INDEX, errorOf(() -> registry.updateAllocation(2, 100)));
        assertEquals(4000, registry.get(1).getAllocationBps());
    }

    @Test
    void removeIsIdempotentAndFreesAllocation() {
        registry.addStrategy("strategy-a", 6000, StrategyKind.CONVERTIBLE, false);
        registry.addStrategy("strategy-b", 4000, StrategyKind.CONVERTIBLE, false);

        assertTrue(registry.removeStrategy(0));
        assertFalse(registry.removeStrategy(0));

        assertFalse(registry.get(0).isActive());
        assertNotNull(registry.get(0).getRemovedAt());
        assertEquals(4000, registry.totalActiveAllocationBps());
        assertEquals(1, fx.eventsOf(StrategyRemovedEvent.class).size());
        assertEquals(ErrorCode.STRATEGY_INACTIVE, errorOf(() -> registry.updateAllocation(0, 100)));
        assertEquals(ErrorCode.INVALID_INDEX, errorOf(() -> registry.removeStrategy(-1)));

        registry.addStrategy("strategy-c", 6000, StrategyKind.CONVERTIBLE, false);
        assertEquals(10_000, registry.totalActiveAllocationBps());
    }

    @Test
    void returnedEntriesAreCopies() {
        registry.addStrategy("strategy-a", 2000, StrategyKind.CONVERTIBLE, false);

        registry.get(0).setAllocationBps(9999);
        registry.strategies().get(0).setActive(false);

        assertEquals(2000, registry.get(0).getAllocationBps());
        assertTrue(registry.get(0).isActive());
    }

    @Test
    void directStrategiesNeedNoEndpoint() {
        assertEquals(0, registry.addStrategy("treasury", 2500, StrategyKind.DIRECT, false));
        assertFalse(registry.get(0).isConvertible());
    }
}
