package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

public record WithdrawnEvent(String caller, String receiver, String holder, BigInteger assets, BigInteger shares,
                             Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.WITHDRAWN;
    }

    @Override
    public String describe() {
        return String.format("%s burned %s shares of %s and paid %s assets to %s", caller, shares, holder, assets, receiver);
    }
}
