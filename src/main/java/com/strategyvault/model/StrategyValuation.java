package com.strategyvault.model;

import java.math.BigInteger;

public record StrategyValuation(StrategyAllocation strategy, BigInteger heldUnits, BigInteger value) {
}
