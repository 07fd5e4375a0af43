package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

public record DepositedEvent(String caller, String holder, BigInteger assets, BigInteger shares,
                             Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.DEPOSITED;
    }

    @Override
    public String describe() {
        return String.format("%s deposited %s assets for %s shares to %s", caller, assets, shares, holder);
    }
}
