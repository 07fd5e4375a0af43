package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Yield (positive delta) or loss (negative delta) observed between two valuation snapshots.
 */
public record ValuationChangedEvent(BigInteger previousTotal, BigInteger newTotal, BigInteger delta,
                                    Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.VALUATION_CHANGED;
    }

    public boolean isYield() {
        return delta.signum() > 0;
    }

    @Override
    public String describe() {
        return String.format("%s of %s: total value %s -> %s", isYield() ? "yield" : "loss", delta.abs(), previousTotal, newTotal);
    }
}
