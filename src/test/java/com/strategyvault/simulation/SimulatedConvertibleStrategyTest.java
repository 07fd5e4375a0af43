package com.strategyvault.simulation;

import com.strategyvault.asset.InMemoryAssetLedger;
import com.strategyvault.service.UndoJournal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedConvertibleStrategyTest {

    private InMemoryAssetLedger ledger;
    private SimulatedConvertibleStrategy strategy;

    @BeforeEach
    void setUp() {
        UndoJournal journal = new UndoJournal();
        ledger = new InMemoryAssetLedger("USDC", 6, journal);
        strategy = new SimulatedConvertibleStrategy("strat", "Strategy", ledger, journal);
        ledger.mint("vault", n(10_000));
        ledger.approve("vault", "strat", n(10_000));
    }

    private static BigInteger n(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    void firstDepositIssuesUnitsOneToOne() {
        assertEquals(n(1000), strategy.deposit("vault", n(1000)));

        assertEquals(n(1000), strategy.balanceOf("vault"));
        assertEquals(n(1000), strategy.totalAssets());
        assertEquals(n(9000), ledger.balanceOf("vault"));
    }

    @Test
    void yieldRaisesUnitPrice() {
        strategy.deposit("vault", n(1000));

        assertEquals(n(100), strategy.simulateYield(1000));

        assertEquals(n(1100), strategy.convertToAssets(n(1000)));
        // 100 * 1000 / 1100 = 90.9
        assertEquals(n(90), strategy.convertToShares(n(100)));
        assertEquals(n(90), strategy.deposit("vault", n(100)));
    }

    @Test
    void redeemPaysProRata() {
        strategy.deposit("vault", n(1000));
        strategy.simulateLoss(2500);

        assertEquals(n(375), strategy.redeem("vault", n(500)));

        assertEquals(n(500), strategy.totalUnits());
        assertEquals(n(9375), ledger.balanceOf("vault"));
    }

    @Test
    void invalidCallsThrow() {
        strategy.deposit("vault", n(100));

        assertThrows(IllegalArgumentException.class, () -> strategy.deposit("vault", BigInteger.ZERO));
        assertThrows(IllegalArgumentException.class, () -> strategy.redeem("vault", n(-1)));
        assertThrows(IllegalStateException.class, () -> strategy.redeem("vault", n(101)));
        assertThrows(IllegalStateException.class, () -> strategy.deposit("stranger", n(1)));
    }

    @Test
    void lockedStrategyRefusesRedemption() {
        SimulatedLockedStrategy locked = new SimulatedLockedStrategy("locked", "Locked", ledger, new UndoJournal(), true);
        ledger.approve("vault", "locked", n(100));
        locked.deposit("vault", n(100));

        assertTrue(locked.isLocked());
        assertThrows(IllegalStateException.class, () -> locked.redeem("vault", n(10)));

        locked.unlock();
        assertEquals(n(10), locked.redeem("vault", n(10)));
    }
}
