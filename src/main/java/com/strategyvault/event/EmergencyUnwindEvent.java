package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record EmergencyUnwindEvent(BigInteger recovered, List<String> skippedStrategies,
                                   Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.EMERGENCY_UNWIND;
    }

    @Override
    public String describe() {
        return String.format("emergency unwind recovered %s assets, skipped %s", recovered, skippedStrategies);
    }
}
