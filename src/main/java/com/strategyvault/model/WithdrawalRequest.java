package com.strategyvault.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A withdrawal that idle liquidity could not cover. The claim is fixed in asset terms
 * when the request is created; shares were burned at that point.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class WithdrawalRequest {

    private int requestId;
    private String holder;
    private BigInteger sharesBurned;
    private BigInteger assetsOwed;
    private Instant createdAt;

    @Builder.Default
    private WithdrawalStatus status = WithdrawalStatus.PENDING;

    private Instant completedAt;

    public boolean isCompleted() {
        return status == WithdrawalStatus.COMPLETED;
    }

    public WithdrawalRequest copy() {
        return toBuilder().build();
    }
}
