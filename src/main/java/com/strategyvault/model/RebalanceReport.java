package com.strategyvault.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

public record RebalanceReport(RebalancePlan plan, List<RebalanceMovement> movements,
                              BigInteger divested, BigInteger invested, BigInteger idleAfter,
                              Instant completedAt) {
}
