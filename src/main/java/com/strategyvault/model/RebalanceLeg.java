package com.strategyvault.model;

import java.math.BigInteger;

/**
 * One planned capital movement. {@code amount} is always positive; the direction
 * is given by the list the leg sits in.
 */
public record RebalanceLeg(int strategyIndex, String address, StrategyKind kind,
                           BigInteger currentValue, BigInteger targetValue, BigInteger amount) {
}
