package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

public record RebalanceCompletedEvent(BigInteger totalValue, BigInteger divested, BigInteger invested,
                                      BigInteger idleAfter, Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.REBALANCE_COMPLETED;
    }

    @Override
    public String describe() {
        return String.format("rebalance on value %s: divested %s, invested %s, idle now %s",
                totalValue, divested, invested, idleAfter);
    }
}
