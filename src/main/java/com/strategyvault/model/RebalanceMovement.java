package com.strategyvault.model;

import java.math.BigInteger;

/**
 * What actually moved for one leg. For an investment capped by idle liquidity
 * {@code assets} can be lower than the planned amount.
 */
public record RebalanceMovement(int strategyIndex, String address, Direction direction,
                                BigInteger assets, BigInteger units) {

    public enum Direction {
        DIVEST,
        INVEST
    }
}
