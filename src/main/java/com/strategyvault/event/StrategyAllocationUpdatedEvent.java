package com.strategyvault.event;

import java.time.Instant;

public record StrategyAllocationUpdatedEvent(int index, String address, int previousBps, int newBps,
                                             Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.STRATEGY_ALLOCATION_UPDATED;
    }

    @Override
    public String describe() {
        return String.format("strategy #%d %s allocation %d -> %d bps", index, address, previousBps, newBps);
    }
}
