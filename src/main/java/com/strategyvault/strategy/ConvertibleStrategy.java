package com.strategyvault.strategy;

import java.math.BigInteger;

/**
 * Capability contract of a strategy that issues share-like units against deposited assets.
 *
 * Implementations are external and untrusted: the vault verifies what it can on the
 * asset ledger and treats any exception as a failure of the enclosing operation.
 */
public interface ConvertibleStrategy {

    String address();

    /**
     * Pull {@code assets} from {@code caller} (which must have approved this strategy)
     * and credit units to the caller.
     *
     * @return units issued
     */
    BigInteger deposit(String caller, BigInteger assets);

    /**
     * Burn {@code units} of {@code caller} and send the matching assets to the caller.
     *
     * @return assets paid out
     */
    BigInteger redeem(String caller, BigInteger units);

    BigInteger convertToAssets(BigInteger units);

    BigInteger convertToShares(BigInteger assets);

    BigInteger balanceOf(String holder);
}
