package com.strategyvault.event;

import java.math.BigInteger;
import java.time.Instant;

public record WithdrawalQueuedEvent(String holder, BigInteger shares, BigInteger assets, int requestId,
                                    Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.WITHDRAWAL_QUEUED;
    }

    @Override
    public String describe() {
        return String.format("request #%d of %s queued: %s shares burned, %s assets owed", requestId, holder, shares, assets);
    }
}
