package com.strategyvault.event;

import com.strategyvault.model.StrategyKind;

import java.time.Instant;

public record StrategyAddedEvent(int index, String address, int allocationBps, StrategyKind kind,
                                 boolean hasLockup, Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.STRATEGY_ADDED;
    }

    @Override
    public String describe() {
        return String.format("strategy #%d %s (%s, lockup=%s) added at %d bps", index, address, kind, hasLockup, allocationBps);
    }
}
