package com.strategyvault.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read model of the pool's headline numbers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class VaultMetrics {

    private BigInteger totalValue;
    private BigInteger totalShares;

    // Assets one whole share (10^decimals units) converts to
    private BigInteger pricePerShare;

    private BigInteger totalQueued;
    private BigInteger idleBalance;
    private BigInteger netAssetValue;
    private int activeStrategies;
    private int totalAllocationBps;
    private boolean paused;
    private BigInteger lastValuation;
    private Instant lastValuationAt;
}
