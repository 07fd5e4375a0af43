package com.strategyvault.model;

import java.math.BigInteger;
import java.util.List;

/**
 * @param recovered          assets returned to idle balance
 * @param movements          one entry per strategy that was redeemed
 * @param skippedStrategies  addresses of direct strategies that hold value but cannot be unwound
 */
public record EmergencyUnwindReport(BigInteger recovered, List<RebalanceMovement> movements,
                                    List<String> skippedStrategies, BigInteger idleAfter) {
}
