package com.strategyvault.event;

import java.time.Instant;

public record StrategyRemovedEvent(int index, String address, Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.STRATEGY_REMOVED;
    }

    @Override
    public String describe() {
        return String.format("strategy #%d %s deactivated", index, address);
    }
}
