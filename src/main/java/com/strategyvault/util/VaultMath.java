package com.strategyvault.util;

import java.math.BigInteger;

/**
 * Fixed-point helpers for asset and share amounts.
 * All amounts are integer base units (10^decimals per whole token).
 */
public final class VaultMath {

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private VaultMath() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * floor(a * b / denominator)
     */
    public static BigInteger mulDivDown(BigInteger a, BigInteger b, BigInteger denominator) {
        return a.multiply(b).divide(denominator);
    }

    /**
     * ceil(a * b / denominator), for non-negative operands
     */
    public static BigInteger mulDivUp(BigInteger a, BigInteger b, BigInteger denominator) {
        BigInteger[] qr = a.multiply(b).divideAndRemainder(denominator);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    public static BigInteger bpsOf(BigInteger amount, int bps) {
        return mulDivDown(amount, BigInteger.valueOf(bps), BPS_DENOMINATOR);
    }

    /**
     * a - b, floored at zero
     */
    public static BigInteger subtractFloorZero(BigInteger a, BigInteger b) {
        BigInteger diff = a.subtract(b);
        return diff.signum() < 0 ? BigInteger.ZERO : diff;
    }

    public static boolean isPositive(BigInteger value) {
        return value != null && value.signum() > 0;
    }

    public static BigInteger unit(int decimals) {
        return BigInteger.TEN.pow(decimals);
    }
}
