package com.strategyvault.asset;

import java.math.BigInteger;

/**
 * Transfer primitive for the vault's single underlying asset.
 *
 * Accounts are opaque string addresses. Calls that cannot be honoured return
 * {@code false} rather than throwing; callers decide how to treat a refusal.
 */
public interface AssetLedger {

    String symbol();

    int decimals();

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    boolean transfer(String from, String to, BigInteger amount);

    /**
     * Move {@code amount} from {@code from} to {@code to} on behalf of {@code spender},
     * consuming the allowance {@code from} granted to {@code spender}.
     */
    boolean transferFrom(String spender, String from, String to, BigInteger amount);

    boolean approve(String owner, String spender, BigInteger amount);

    /**
     * Create new units out of thin air (faucet, simulated yield).
     */
    void mint(String to, BigInteger amount);

    /**
     * Destroy units (simulated loss).
     */
    boolean burn(String from, BigInteger amount);
}
