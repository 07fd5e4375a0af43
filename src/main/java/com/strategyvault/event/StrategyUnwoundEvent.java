package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

public record StrategyUnwoundEvent(int index, String address, BigInteger unitsRedeemed, BigInteger assetsRecovered,
                                   Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.STRATEGY_UNWOUND;
    }

    @Override
    public String describe() {
        return String.format("strategy #%d %s unwound: %s units -> %s assets", index, address, unitsRedeemed, assetsRecovered);
    }
}
