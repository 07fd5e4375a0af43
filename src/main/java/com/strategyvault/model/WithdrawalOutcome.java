package com.strategyvault.model;

import java.math.BigInteger;

/**
 * Result of a withdraw/redeem call: either paid out now or queued under {@code requestId}.
 */
public record WithdrawalOutcome(SettlementType settlement, String owner, String receiver,
                                BigInteger sharesBurned, BigInteger assets, Integer requestId) {

    public static WithdrawalOutcome immediate(String owner, String receiver, BigInteger shares, BigInteger assets) {
        return new WithdrawalOutcome(SettlementType.IMMEDIATE, owner, receiver, shares, assets, null);
    }

    public static WithdrawalOutcome queued(String owner, BigInteger shares, BigInteger assets, int requestId) {
        return new WithdrawalOutcome(SettlementType.QUEUED, owner, owner, shares, assets, requestId);
    }

    public boolean isQueued() {
        return settlement == SettlementType.QUEUED;
    }
}
