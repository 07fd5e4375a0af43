package com.strategyvault.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Deltas computed from a single valuation snapshot before any strategy is called.
 *
 * @param totalValue  pool value at the snapshot
 * @param investable  value the targets are computed on (total minus escrowed queue claims)
 * @param idleBalance idle balance at the snapshot
 */
public record RebalancePlan(BigInteger totalValue, BigInteger investable, BigInteger idleBalance,
                            List<RebalanceLeg> divestments, List<RebalanceLeg> investments) {

    public boolean isEmpty() {
        return divestments.isEmpty() && investments.isEmpty();
    }
}
