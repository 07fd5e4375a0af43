package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

public record WithdrawalCompletedEvent(String holder, int requestId, BigInteger assets,
                                       Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.WITHDRAWAL_COMPLETED;
    }

    @Override
    public String describe() {
        return String.format("request #%d of %s completed: %s assets paid", requestId, holder, assets);
    }
}
